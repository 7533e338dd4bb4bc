package win.ixuni.quarry.core.operation;

/**
 * Base interface for driver operations
 * <p>
 * Every operation a driver can run (CreateBucket, PutObject, LookupObject, ...) is a small value class
 * implementing this interface; {@code R} is the result type.
 * 驱动只需为支持的操作注册处理器。
 *
 * @param <R> 操作返回类型
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging)
     *
     * @return 操作名称，如 "LookupObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}

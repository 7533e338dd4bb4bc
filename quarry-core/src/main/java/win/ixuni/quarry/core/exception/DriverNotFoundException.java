package win.ixuni.quarry.core.exception;

/**
 * Driver not found exception
 */
public class DriverNotFoundException extends QuarryException {

    public DriverNotFoundException(String driverName) {
        super("DriverNotFound", "The specified driver does not exist: " + driverName, 500);
    }
}

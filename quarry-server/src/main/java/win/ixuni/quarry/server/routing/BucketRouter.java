package win.ixuni.quarry.server.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import win.ixuni.quarry.core.config.BucketRoutingRule;
import win.ixuni.quarry.core.config.QuarryProperties;
import win.ixuni.quarry.core.driver.StorageDriver;
import win.ixuni.quarry.core.exception.DriverNotFoundException;
import win.ixuni.quarry.server.registry.DriverRegistry;

import java.util.Comparator;

/**
 * 按 bucket 名选择驱动：优先级数值最小的匹配规则胜出，没有匹配时落到默认驱动
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BucketRouter {

    private final QuarryProperties properties;
    private final DriverRegistry driverRegistry;

    public StorageDriver route(String bucketName) {
        QuarryProperties.RoutingConfig routing = properties.getRouting();
        String target = routing.getBuckets().stream()
                .sorted(Comparator.comparingInt(BucketRoutingRule::getPriority))
                .filter(rule -> rule.matches(bucketName))
                .findFirst()
                .map(BucketRoutingRule::getDriver)
                .orElse(routing.getDefaultDriver());

        if (!StringUtils.hasText(target)) {
            throw new DriverNotFoundException("no driver configured for bucket " + bucketName);
        }
        log.trace("{} -> {}", bucketName, target);
        return driverRegistry.getDriver(target);
    }
}

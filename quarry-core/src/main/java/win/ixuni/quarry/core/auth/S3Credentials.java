package win.ixuni.quarry.core.auth;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * S3 access key pair
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class S3Credentials {

    private String accessKeyId;

    private String secretAccessKey;

    /**
     * Disabled keys are treated as unknown
     */
    @Builder.Default
    private boolean enabled = true;

    private String description;
}

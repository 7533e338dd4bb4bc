package win.ixuni.quarry.driver.local.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.quarry.core.util.SidecarMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Content of one {@code key.quarry.meta} file: the current version plus, when versioning is enabled, every
 * version ever committed (oldest first)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SidecarIndex {

    private SidecarMetadata current;

    private List<SidecarMetadata> versions = new ArrayList<>();

    public static SidecarIndex of(SidecarMetadata current) {
        List<SidecarMetadata> versions = new ArrayList<>();
        if (current.getVersionId() != null) {
            versions.add(current);
        }
        return new SidecarIndex(current, versions);
    }

    public SidecarIndex withVersion(SidecarMetadata next) {
        List<SidecarMetadata> all = new ArrayList<>(versions);
        all.add(next);
        return new SidecarIndex(next, all);
    }

    public SidecarMetadata findVersion(String versionId) {
        return versions.stream()
                .filter(v -> versionId.equals(v.getVersionId()))
                .findFirst()
                .orElse(null);
    }
}

package dev.pagestack.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateVersionRequest {

    @Size(max = 255, message = "Version name must be at most 255 characters")
    private String versionName;

    @Size(max = 50, message = "Maximum 50 metadata entries allowed")
    private Map<String, Object> metadata;

    /** Publish the new version in the same transaction. */
    private boolean publish;
}

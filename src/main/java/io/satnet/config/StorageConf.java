package io.satnet.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.satnet.storage.StorageBackend;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StorageConf {

    @JsonProperty("backend")
    private StorageBackend backend;

    @JsonProperty("max_bundles")
    private Integer maxBundles;

    /**
     * Database file name, resolved against the storage directory.
     */
    @JsonProperty("file_name")
    private String fileName;
}

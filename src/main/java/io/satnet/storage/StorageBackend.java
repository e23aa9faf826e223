package io.satnet.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum StorageBackend {
    MEMORY("memory"),
    NITRITE("nitrite"),
    ;

    private final String backendName;

    @JsonCreator
    public static StorageBackend parseName(@NonNull String backendName) {
        return Arrays.stream(StorageBackend.values())
                .filter(backend -> backend.getBackendName().equals(backendName.strip().toLowerCase()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown storage backend: " + backendName));
    }
}

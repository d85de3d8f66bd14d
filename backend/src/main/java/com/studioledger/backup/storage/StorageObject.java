package com.studioledger.backup.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageObject {

    public static final Comparator<StorageObject> NEWEST_FIRST =
            Comparator.comparing(StorageObject::getLastModified,
                    Comparator.nullsLast(Comparator.reverseOrder()));

    private String key;
    private long size;
    private Instant lastModified;
}

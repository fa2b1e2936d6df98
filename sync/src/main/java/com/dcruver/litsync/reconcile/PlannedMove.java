package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.library.CollectionPath;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class PlannedMove {
    private final String key;
    private final CollectionPath fromPath;
    private final CollectionPath toPath;
    private final Path file;
}

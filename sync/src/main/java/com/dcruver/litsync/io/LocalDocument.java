package com.dcruver.litsync.io;

import com.dcruver.litsync.library.CollectionPath;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.nio.file.Path;

/**
 * A note in the vault that carries a library key.
 */
@Data
@Builder
@With
public class LocalDocument {
    private final String key;

    // Relative to the vault root; ROOT for files directly in the vault
    private final CollectionPath folderPath;

    private final Path file;
    private final String title;

    public String getFileName() {
        return file.getFileName().toString();
    }
}

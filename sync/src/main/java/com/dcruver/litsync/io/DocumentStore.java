package com.dcruver.litsync.io;

import com.dcruver.litsync.library.CollectionPath;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The local note collection.
 */
public interface DocumentStore {

    Path getRoot();

    /**
     * Every keyed note in the store, ordered by path.
     */
    List<LocalDocument> listDocuments() throws IOException;

    /**
     * Atomically create or replace a note in the given folder.
     *
     * @return absolute path of the written file
     */
    Path write(CollectionPath folder, String fileName, byte[] content) throws IOException;

    /**
     * Folder names directly under the root that hold no managed notes.
     */
    List<String> reservedFolders();
}

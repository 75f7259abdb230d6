package com.scholary.sorter.api;

import java.util.List;

/** Sub-directories of a browsed directory; {@code parent} is {@code null} at a filesystem root. */
public record DirectoryListing(String path, List<FolderRef> entries, String parent) {}

package com.scholary.sorter.api;

import com.scholary.sorter.filesystem.FolderInspector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Directory browsing for the root pickers. */
@RestController
@Tag(name = "Browse", description = "List sub-directories for choosing roots")
public class BrowseController {

  private final FolderInspector inspector;

  public BrowseController(FolderInspector inspector) {
    this.inspector = inspector;
  }

  @GetMapping("/api/list")
  @Operation(
      summary = "List sub-directories",
      description = "Without a path lists the user's home directory. Hidden entries are omitted.")
  public DirectoryListing list(@RequestParam(required = false) String path) throws IOException {
    String requested = path == null || path.isBlank() ? System.getProperty("user.home") : path;
    Path directory = Paths.get(requested).toAbsolutePath().normalize();

    List<FolderRef> entries =
        inspector.listSubdirectories(directory).stream()
            .map(child -> new FolderRef(child.toString(), child.getFileName().toString()))
            .toList();
    Path parent = directory.getParent();
    return new DirectoryListing(
        directory.toString(), entries, parent == null ? null : parent.toString());
  }
}

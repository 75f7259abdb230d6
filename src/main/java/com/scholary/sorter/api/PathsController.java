package com.scholary.sorter.api;

import com.scholary.sorter.paths.PathStagingManager;
import com.scholary.sorter.paths.PathsConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Locale;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read and change the source/target roots. */
@RestController
@RequestMapping("/api/paths")
@Tag(name = "Paths", description = "Two-phase change of the source and target roots")
public class PathsController {

  private final PathStagingManager paths;

  public PathsController(PathStagingManager paths) {
    this.paths = paths;
  }

  @GetMapping
  @Operation(summary = "Current and staged roots")
  public PathsConfig get() {
    return paths.snapshot();
  }

  /**
   * Stage roots, or apply the staged ones.
   *
   * <p>With {@code action} set the request confirms or cancels; otherwise the supplied roots are
   * staged.
   */
  @PostMapping
  @Operation(
      summary = "Stage, confirm or cancel roots",
      description =
          "Send source_dir and/or target_dir to stage them, or action=confirm|cancel to apply or "
              + "discard what is staged. Confirming validates the resulting pair.")
  public PathsConfig update(@RequestBody PathsUpdateRequest request) {
    if (request.action() != null && !request.action().isBlank()) {
      return switch (request.action().trim().toLowerCase(Locale.ROOT)) {
        case "confirm" -> paths.confirm();
        case "cancel" -> paths.cancel();
        default -> throw new IllegalArgumentException("Unknown action: " + request.action());
      };
    }
    return paths.stage(request.sourceDir(), request.targetDir());
  }
}

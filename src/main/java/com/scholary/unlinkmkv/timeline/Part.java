package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.UnlinkException;
import java.nio.file.Path;
import java.util.List;

/**
 * One file, in order, of the final append-mux.
 *
 * @param kind where the media comes from
 * @param file the external file or the processed original
 * @param sliceIndex 1-based slice number for {@link Kind#INTERNAL_SPLIT}, 0 otherwise
 */
public record Part(Kind kind, Path file, int sliceIndex) {

  public enum Kind {
    /** Another file of the set, taken whole. */
    EXTERNAL,
    /** A slice carved out of the processed file. */
    INTERNAL_SPLIT,
    /** The processed file itself, unsplit. */
    WHOLE
  }

  public static Part external(Path file) {
    return new Part(Kind.EXTERNAL, file, 0);
  }

  public static Part slice(Path original, int sliceIndex) {
    return new Part(Kind.INTERNAL_SPLIT, original, sliceIndex);
  }

  public static Part whole(Path original) {
    return new Part(Kind.WHOLE, original, 0);
  }

  /**
   * The file to mux for this part.
   *
   * @param slices ordered output of the split step (empty if nothing was split)
   * @throws UnlinkException if the split step produced fewer slices than needed
   */
  public Path resolve(List<Path> slices) {
    if (kind != Kind.INTERNAL_SPLIT) {
      return file;
    }
    if (sliceIndex > slices.size()) {
      throw new UnlinkException(
          String.format(
              "Slice %d of %s is required but splitting produced %d slices",
              sliceIndex, file.getFileName(), slices.size()));
    }
    return slices.get(sliceIndex - 1);
  }
}

package com.scholary.unlinkmkv.chapter;

import com.scholary.unlinkmkv.UnlinkException;

/** Thrown when chapter XML cannot be parsed or carries unusable values. */
public class MalformedChapterStructureException extends UnlinkException {

  public MalformedChapterStructureException(String message) {
    super(message);
  }

  public MalformedChapterStructureException(String message, Throwable cause) {
    super(message, cause);
  }
}

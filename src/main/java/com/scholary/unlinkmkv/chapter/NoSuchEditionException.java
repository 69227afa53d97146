package com.scholary.unlinkmkv.chapter;

import com.scholary.unlinkmkv.UnlinkException;

/** Thrown when the requested (1-based) edition does not exist in the chapter structure. */
public class NoSuchEditionException extends UnlinkException {

  private final int requested;
  private final int available;

  public NoSuchEditionException(int requested, int available) {
    super(
        String.format(
            "Edition %d requested but the chapter structure has %d edition(s)",
            requested, available));
    this.requested = requested;
    this.available = available;
  }

  public int getRequested() {
    return requested;
  }

  public int getAvailable() {
    return available;
  }
}

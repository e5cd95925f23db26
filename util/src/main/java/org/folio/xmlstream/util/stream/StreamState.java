package org.folio.xmlstream.util.stream;

public enum StreamState {
  /** Not connected yet. */
  IDLE,
  /** Connected; root start tag not read yet. */
  AWAITING_ROOT,
  /** Root element open. */
  IN_STREAM,
  /** Parse failure being reported. */
  ERRORED,
  /** Terminal. */
  ENDED
}

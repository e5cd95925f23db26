package org.folio.xmlstream.util.stream;

public class ConnectionInfo {
  private final String localAddress;
  private final String remoteAddress;

  public ConnectionInfo(String localAddress, String remoteAddress) {
    this.localAddress = localAddress;
    this.remoteAddress = remoteAddress;
  }

  public String getLocalAddress() {
    return localAddress;
  }

  public String getRemoteAddress() {
    return remoteAddress;
  }

  @Override
  public String toString() {
    return remoteAddress + " -> " + localAddress;
  }
}

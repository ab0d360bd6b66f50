package com.riskrecon.integration.venue;

public class VenueConnectorException extends RuntimeException {
  private final String venue;
  private final Integer httpStatus;
  private final String errorCode;

  public VenueConnectorException(
      String venue, String message, Integer httpStatus, String errorCode, Throwable cause) {
    super(message, cause);
    this.venue = venue;
    this.httpStatus = httpStatus;
    this.errorCode = errorCode;
  }

  public VenueConnectorException(String venue, String message, Integer httpStatus) {
    this(venue, message, httpStatus, httpStatus == null ? null : "HTTP_" + httpStatus, null);
  }

  public static VenueConnectorException timeout(String venue, long timeoutMillis) {
    return new VenueConnectorException(
        venue, "timed out after " + timeoutMillis + "ms", null, "TIMEOUT", null);
  }

  public String venue() {
    return venue;
  }

  public Integer httpStatus() {
    return httpStatus;
  }

  public String errorCode() {
    return errorCode;
  }
}

/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

/**
 * Thrown when the partner service answers with a body that is not a list
 * of user objects. Repeating the request does not help.
 */
public class PartnerResponseException extends Exception {

  private static final long serialVersionUID = -2950114620471853174L;

  public PartnerResponseException(String message) {
    super(message);
  }

  public PartnerResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}

package org.erpsuite.currency.service.dto;

/** How a rate resolution was obtained. */
public enum ResolutionKind {
  /** Source and target are the same currency; rate is 1. */
  IDENTITY,

  /** A record for the requested direction applied. */
  DIRECT,

  /** Only a record for the opposite direction applied; its rate and inverse rate are swapped. */
  INVERSE
}

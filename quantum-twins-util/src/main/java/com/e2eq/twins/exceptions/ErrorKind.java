package com.e2eq.twins.exceptions;

/**
 * Coarse classification of the errors surfaced by the twins client.
 */
public enum ErrorKind {
   COMPILE_ERROR,
   VALIDATION_FAILED,
   NOT_FOUND,
   ALREADY_EXISTS,
   PRECONDITION_FAILED,
   REFERENTIAL_INTEGRITY,
   UNSUPPORTED,
   BAD_ARGUMENT,
   STORAGE
}

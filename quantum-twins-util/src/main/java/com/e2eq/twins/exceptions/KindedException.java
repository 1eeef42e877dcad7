package com.e2eq.twins.exceptions;

public interface KindedException {
   ErrorKind getErrorKind();
}

package com.example.datalake.membank.controller;

import com.example.datalake.membank.exception.QuerySyntaxException;
import com.example.datalake.membank.exception.StorageUnavailableException;
import com.example.datalake.membank.validation.ValidationException;
import java.util.List;
import org.springframework.http.HttpStatus;

/** Status and {@code errors} body shared by the controllers. */
final class ApiErrors {

  private ApiErrors() {}

  static HttpStatus statusFor(Throwable ex) {
    if (ex instanceof ValidationException) {
      return HttpStatus.BAD_REQUEST;
    }
    if (ex instanceof QuerySyntaxException) {
      return HttpStatus.UNPROCESSABLE_ENTITY;
    }
    if (ex instanceof StorageUnavailableException) {
      return HttpStatus.SERVICE_UNAVAILABLE;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  static List<String> messagesFor(Throwable ex) {
    if (ex instanceof ValidationException validation) {
      return List.copyOf(validation.getReasons());
    }
    if (ex instanceof QuerySyntaxException || ex instanceof StorageUnavailableException) {
      return List.of(String.valueOf(ex.getMessage()));
    }
    String detail = ex.getMessage();
    return List.of((detail == null || detail.isBlank())
        ? "Unexpected error occurred."
        : "Unexpected error: " + detail);
  }

  static boolean isExpected(Throwable ex) {
    return statusFor(ex) != HttpStatus.INTERNAL_SERVER_ERROR;
  }
}

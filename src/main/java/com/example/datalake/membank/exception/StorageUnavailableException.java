package com.example.datalake.membank.exception;

/** The backing store could not be opened or reached. */
public class StorageUnavailableException extends StorageException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.example.datalake.membank.exception;

/** Base type for faults raised by the storage collaborator. */
public abstract class StorageException extends RuntimeException {

  protected StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}

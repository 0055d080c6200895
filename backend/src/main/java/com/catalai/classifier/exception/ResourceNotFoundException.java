package com.catalai.classifier.exception;

public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }

  public static ResourceNotFoundException of(String resource, String id) {
    return new ResourceNotFoundException(String.format("%s '%s' not found", resource, id));
  }
}

package com.stratdsl.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with identifier: %s", resourceType, identifier));
    }

    public ResourceNotFoundException(String resourceType, String identifier, Throwable cause) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s could not be read with identifier: %s", resourceType, identifier),
                cause);
    }
}

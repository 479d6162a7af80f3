package com.williamcallahan.kbingest.service;

/**
 * Signals that the remote model service returned a response that cannot be used.
 *
 * <p>Raised inside the SDK adapter and converted into a failed {@link RemoteCallResult} before it
 * leaves the adapter, so callers retry instead of recording a corrupted vector.</p>
 */
public class RemoteServiceException extends RuntimeException {

    public RemoteServiceException(String message) {
        super(message);
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

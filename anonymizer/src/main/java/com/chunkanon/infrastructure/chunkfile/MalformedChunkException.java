package com.chunkanon.infrastructure.chunkfile;

public class MalformedChunkException extends RuntimeException {

    public MalformedChunkException(String message) {
        super(message);
    }

    public MalformedChunkException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.expirebot.expiry.matrix;

public class MatrixEventNotFoundException extends MatrixRequestException {

    public MatrixEventNotFoundException(String message, String errcode) {
        super(message, 404, errcode);
    }
}

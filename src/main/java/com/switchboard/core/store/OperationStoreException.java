package com.switchboard.core.store;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.util.Map;

/**
 * The backing database rejected a read or write.
 */
public class OperationStoreException extends SwitchboardException {

    public OperationStoreException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, false, Map.of(), cause);
    }
}

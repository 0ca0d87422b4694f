package com.nethernet.server;

import com.nethernet.NetherNetException;

/**
 * The host is missing configuration an offer needs, such as signaling credentials.
 */
public class ConfigurationException extends NetherNetException {

    public ConfigurationException(String message) {
        super(message);
    }
}

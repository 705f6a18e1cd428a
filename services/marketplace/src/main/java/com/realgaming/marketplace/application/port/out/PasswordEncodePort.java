package com.realgaming.marketplace.application.port.out;

public interface PasswordEncodePort {
    String encode(String data);
    boolean matches(String data, String hashedData);
}

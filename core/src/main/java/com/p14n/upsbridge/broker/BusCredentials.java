package com.p14n.upsbridge.broker;

/**
 * Username and password presented to the broker. Either may be empty, in
 * which case the connection is anonymous.
 */
public record BusCredentials(String username, String password) {

    public static BusCredentials anonymous() {
        return new BusCredentials("", "");
    }

    public boolean hasUsername() {
        return username != null && !username.isEmpty();
    }

    public char[] passwordChars() {
        return password == null ? new char[0] : password.toCharArray();
    }

    @Override
    public String toString() {
        return "BusCredentials[username=" + username + "]";
    }
}

package com.nethernet.signaling;

import java.util.List;
import java.util.Objects;

/**
 * One STUN/TURN server handed out by the signaling service.
 */
public final class IceServer {

    private final List<String> urls;
    private final String username;
    private final String credential;

    public IceServer(List<String> urls, String username, String credential) {
        this.urls = List.copyOf(urls);
        this.username = username;
        this.credential = credential;
    }

    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }

    public List<String> getUrls() {
        return urls;
    }

    public String getUsername() {
        return username;
    }

    public String getCredential() {
        return credential;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IceServer)) return false;
        IceServer that = (IceServer) o;
        return urls.equals(that.urls)
            && Objects.equals(username, that.username)
            && Objects.equals(credential, that.credential);
    }

    @Override
    public int hashCode() {
        return Objects.hash(urls, username, credential);
    }

    @Override
    public String toString() {
        return "IceServer" + urls;
    }
}

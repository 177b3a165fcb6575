package com.example.mailmerge.security;

import com.example.mailmerge.model.Credential;

/**
 * One-time interactive grant of the Gmail send scope by the account owner.
 * <p>
 * {@link #authorize()} blocks the calling thread until the owner approves or denies access.
 * There is no timeout; the operator interrupts the process to give up.
 */
public interface ConsentFlow {

    Credential authorize();
}

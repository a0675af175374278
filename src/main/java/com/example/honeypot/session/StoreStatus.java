package com.example.honeypot.session;

public enum StoreStatus {
    /** Sessions are written to the external expiring store. */
    CONNECTED,
    /** Sessions live in process memory only and are lost on restart. */
    FALLBACK
}

package com.trustmail.compose;

public enum SendIntent {
    SEND,
    FORWARD,
    REPLY
}

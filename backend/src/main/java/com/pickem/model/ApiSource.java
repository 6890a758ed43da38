package com.pickem.model;

/**
 * External data providers whose identifiers are mapped onto canonical teams and games.
 */
public enum ApiSource {
    NFLVERSE,
    ESPN
}

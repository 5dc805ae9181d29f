package com.lrucache;

/**
 * Entry count and encoded size of a cache at the time it was taken.
 */
public record Stats(long items, long bytes) { }

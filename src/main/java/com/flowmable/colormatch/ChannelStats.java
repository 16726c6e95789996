package com.flowmable.colormatch;

/**
 * Distribution summary of one channel.
 *
 * @param mean Arithmetic mean over every sample
 * @param std  Population standard deviation (divides by N)
 */
public record ChannelStats(double mean, double std) {}

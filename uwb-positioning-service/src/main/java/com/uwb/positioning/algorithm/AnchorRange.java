package com.uwb.positioning.algorithm;

/**
 * An anchor at a known planar position paired with the distance measured from it to the tag.
 *
 * @param slot anchor slot index (A0..A3)
 * @param x anchor x coordinate
 * @param y anchor y coordinate
 * @param distance measured calibrated distance
 */
public record AnchorRange(int slot, double x, double y, double distance) {
}

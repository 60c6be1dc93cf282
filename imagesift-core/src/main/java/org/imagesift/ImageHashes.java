package org.imagesift;

/**
 * The pair of perceptual fingerprints computed for an image.
 *
 * @param averageHash 64-bit average hash
 * @param differenceHash 64-bit difference hash
 */
public record ImageHashes(long averageHash, long differenceHash) {
}

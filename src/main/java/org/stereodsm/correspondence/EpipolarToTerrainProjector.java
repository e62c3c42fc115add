package org.stereodsm.correspondence;

/**
 * Ground projection of an epipolar position of the left image, given a disparity.
 * Provided by the geometry loader of a stereo pair.
 */
@FunctionalInterface
public interface EpipolarToTerrainProjector
{
	/**
	 * @return terrain position [x, y] in the output CRS
	 */
	double[] project( double epipolarX, double epipolarY, double disparity );
}

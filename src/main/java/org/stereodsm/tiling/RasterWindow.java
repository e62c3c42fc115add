package org.stereodsm.tiling;

import java.io.Serializable;

/**
 * Raster origin and size derived from a region at a given resolution.
 * The y axis points down, so {@code ystart} is the region's ymax.
 */
public class RasterWindow implements Serializable
{
	private static final long serialVersionUID = -1770389733640542152L;

	private final double xstart, ystart;
	private final long xsize, ysize;

	public RasterWindow( final double xstart, final double ystart, final long xsize, final long ysize )
	{
		this.xstart = xstart;
		this.ystart = ystart;
		this.xsize = xsize;
		this.ysize = ysize;
	}

	public double getXStart() { return xstart; }
	public double getYStart() { return ystart; }
	public long getXSize() { return xsize; }
	public long getYSize() { return ysize; }

	@Override
	public String toString()
	{
		return "RasterWindow{xstart=" + xstart + ", ystart=" + ystart + ", xsize=" + xsize + ", ysize=" + ysize + "}";
	}
}

package org.stereodsm.correspondence;

/**
 * Discards the simplices lying along one side of the regular sampling grid.
 *
 * The triangulation of a sample is convex while the projected sampling grid may be concave,
 * so the triangulator creates long triangles joining points of the same grid side.
 * A simplex is discarded when its three vertices are on the same side (left, bottom, right or top)
 * of the original grid. Simplices with an interior vertex are kept even when they are thin.
 */
public class SimplexEdgeFilter
{
	private final int gridRows, gridCols;

	/**
	 * @param gridRows
	 * 			number of vertex rows of the sampling grid
	 * @param gridCols
	 * 			number of vertex columns of the sampling grid
	 */
	public SimplexEdgeFilter( final int gridRows, final int gridCols )
	{
		this.gridRows = gridRows;
		this.gridCols = gridCols;
	}

	/**
	 * Replaces by -1 the found simplices that lie on a grid side.
	 *
	 * @param index
	 * 			triangulation of the sample
	 * @param foundSimplices
	 * 			simplex indices (or -1) returned by point location, updated in place
	 */
	public void filterSimplicesOnTheEdges( final SpatialIndex index, final int[] foundSimplices )
	{
		for ( int q = 0; q < foundSimplices.length; ++q )
			if ( foundSimplices[ q ] != -1 && isOnTheEdges( index.getSimplex( foundSimplices[ q ] ) ) )
				foundSimplices[ q ] = -1;
	}

	public boolean isOnTheEdges( final int[] simplex )
	{
		return allMatch( simplex, Side.LEFT ) || allMatch( simplex, Side.BOTTOM ) || allMatch( simplex, Side.RIGHT ) || allMatch( simplex, Side.TOP );
	}

	private boolean allMatch( final int[] simplex, final Side side )
	{
		for ( final int vertex : simplex )
			if ( !isOnSide( vertex, side ) )
				return false;
		return true;
	}

	private boolean isOnSide( final int vertex, final Side side )
	{
		final int j = vertex / gridCols, i = vertex % gridCols;
		switch ( side )
		{
		case LEFT:
			return i == 0;
		case BOTTOM:
			return j == gridRows - 1;
		case RIGHT:
			return i == gridCols - 1;
		case TOP:
			return j == 0;
		default:
			throw new IllegalArgumentException( "Unknown side " + side );
		}
	}

	private static enum Side
	{
		LEFT,
		BOTTOM,
		RIGHT,
		TOP
	}
}

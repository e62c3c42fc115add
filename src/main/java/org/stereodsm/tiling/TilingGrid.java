package org.stereodsm.tiling;

import java.io.Serializable;

/**
 * Corner positions of a regular tiling: (rows+1) x (cols+1) vertices of 2 coordinates.
 * Vertex [j][i] is the top-left corner of the cell at row j and column i,
 * and the cell spans to vertex [j+1][i+1].
 */
public class TilingGrid implements Serializable
{
	private static final long serialVersionUID = -5146420381416946027L;

	private final double[][][] corners;

	/**
	 * @param corners
	 * 			vertex positions indexed as [j][i][0:x, 1:y], copied
	 */
	public TilingGrid( final double[][][] corners )
	{
		if ( corners.length == 0 || corners[ 0 ].length == 0 )
			throw new IllegalArgumentException( "Tiling grid should contain at least one vertex" );

		this.corners = new double[ corners.length ][ corners[ 0 ].length ][];
		for ( int j = 0; j < corners.length; ++j )
		{
			if ( corners[ j ].length != corners[ 0 ].length )
				throw new IllegalArgumentException( "Tiling grid rows should have the same number of vertices" );
			for ( int i = 0; i < corners[ j ].length; ++i )
			{
				if ( corners[ j ][ i ].length != 2 )
					throw new IllegalArgumentException( "Tiling grid vertices should have 2 coordinates" );
				this.corners[ j ][ i ] = corners[ j ][ i ].clone();
			}
		}
	}

	/**
	 * @return number of cell rows
	 */
	public int numRows()
	{
		return corners.length - 1;
	}

	/**
	 * @return number of cell columns
	 */
	public int numCols()
	{
		return corners[ 0 ].length - 1;
	}

	public int numVertexRows()
	{
		return corners.length;
	}

	public int numVertexCols()
	{
		return corners[ 0 ].length;
	}

	public int numVertices()
	{
		return numVertexRows() * numVertexCols();
	}

	public double getX( final int j, final int i )
	{
		return corners[ j ][ i ][ 0 ];
	}

	public double getY( final int j, final int i )
	{
		return corners[ j ][ i ][ 1 ];
	}

	public Box getCell( final int row, final int col )
	{
		return new Box(
				getX( row, col ),
				getY( row, col ),
				getX( row + 1, col + 1 ),
				getY( row + 1, col + 1 ) );
	}

	/**
	 * @return vertices in row-major order, vertex [j][i] at index j * numVertexCols() + i
	 */
	public double[][] flatten()
	{
		final double[][] flat = new double[ numVertices() ][];
		for ( int j = 0; j < numVertexRows(); ++j )
			for ( int i = 0; i < numVertexCols(); ++i )
				flat[ j * numVertexCols() + i ] = corners[ j ][ i ].clone();
		return flat;
	}

	/**
	 * @return region spanned by the first and the last vertex
	 */
	public Box getBounds()
	{
		return new Box(
				getX( 0, 0 ),
				getY( 0, 0 ),
				getX( numVertexRows() - 1, numVertexCols() - 1 ),
				getY( numVertexRows() - 1, numVertexCols() - 1 ) );
	}
}

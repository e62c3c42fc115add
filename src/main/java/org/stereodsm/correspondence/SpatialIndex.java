package org.stereodsm.correspondence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import org.locationtech.jts.triangulate.quadedge.LocateFailureException;
import org.locationtech.jts.triangulate.quadedge.QuadEdgeSubdivision;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.NearestNeighborSearchOnKDTree;

/**
 * Delaunay triangulation and k-d tree over the points of a {@link DisparityBoundSample}.
 *
 * Simplices are stored as triplets of sample point indices. Point location returns the lowest
 * index simplex containing the query (boundaries included), or -1 outside of the convex hull.
 *
 * Coordinates are multiplied by {@code precisionFactor} both when the index is built and when it is queried.
 * The index is immutable, a new one is built whenever the sample changes.
 */
public class SpatialIndex
{
	private final double precisionFactor;
	private final List< Coordinate > scaledPoints;
	private final int[][] simplices;
	private final STRtree simplicesTree;
	private final KDTree< Integer > kdTree;

	public SpatialIndex( final DisparityBoundSample sample, final double precisionFactor ) throws GeometryException
	{
		this.precisionFactor = precisionFactor;

		scaledPoints = new ArrayList<>( sample.size() );
		for ( int k = 0; k < sample.size(); ++k )
			scaledPoints.add( new Coordinate( sample.getX( k ) * precisionFactor, sample.getY( k ) * precisionFactor ) );

		// duplicated positions are triangulated once and point to their first occurrence
		final Map< Coordinate, Integer > siteIndexes = new LinkedHashMap<>();
		for ( int k = 0; k < scaledPoints.size(); ++k )
			siteIndexes.putIfAbsent( scaledPoints.get( k ), k );

		if ( siteIndexes.size() < 3 )
			throw new GeometryException( "Cannot triangulate " + siteIndexes.size() + " distinct points, at least 3 are required" );

		simplices = triangulate( siteIndexes );

		simplicesTree = new STRtree();
		for ( int s = 0; s < simplices.length; ++s )
		{
			final Envelope envelope = new Envelope();
			for ( final int vertex : simplices[ s ] )
				envelope.expandToInclude( scaledPoints.get( vertex ) );
			simplicesTree.insert( envelope, s );
		}
		simplicesTree.build();

		final List< Integer > indexes = new ArrayList<>( scaledPoints.size() );
		final List< RealPoint > positions = new ArrayList<>( scaledPoints.size() );
		for ( int k = 0; k < scaledPoints.size(); ++k )
		{
			indexes.add( k );
			positions.add( new RealPoint( scaledPoints.get( k ).x, scaledPoints.get( k ).y ) );
		}
		kdTree = new KDTree<>( indexes, positions );
	}

	private int[][] triangulate( final Map< Coordinate, Integer > siteIndexes ) throws GeometryException
	{
		final List< ? > triangles;
		try
		{
			final DelaunayTriangulationBuilder builder = new DelaunayTriangulationBuilder();
			builder.setSites( new ArrayList<>( siteIndexes.keySet() ) );
			final QuadEdgeSubdivision subdivision = builder.getSubdivision();
			triangles = subdivision.getTriangleCoordinates( false );
		}
		catch ( final LocateFailureException e )
		{
			throw new GeometryException( "Delaunay triangulation failed: " + e.getMessage(), e );
		}

		final Map< Coordinate, Integer > lookup = new HashMap<>( siteIndexes );
		final List< int[] > validSimplices = new ArrayList<>();
		for ( final Object triangle : triangles )
		{
			final Coordinate[] vertices = ( Coordinate[] ) triangle;
			final int[] simplex = new int[ 3 ];
			for ( int v = 0; v < 3; ++v )
			{
				final Integer index = lookup.get( new Coordinate( vertices[ v ].x, vertices[ v ].y ) );
				if ( index == null )
					throw new GeometryException( "Triangulation vertex " + vertices[ v ] + " does not belong to the sample" );
				simplex[ v ] = index;
			}

			// flat simplices cannot contain anything
			if ( Orientation.index( vertices[ 0 ], vertices[ 1 ], vertices[ 2 ] ) != Orientation.COLLINEAR )
				validSimplices.add( simplex );
		}

		if ( validSimplices.isEmpty() )
			throw new GeometryException( "Delaunay triangulation is degenerate: all " + siteIndexes.size() + " points are collinear" );

		return validSimplices.toArray( new int[ 0 ][] );
	}

	public double getPrecisionFactor()
	{
		return precisionFactor;
	}

	public int numPoints()
	{
		return scaledPoints.size();
	}

	public int numSimplices()
	{
		return simplices.length;
	}

	/**
	 * @return sample point indices of the simplex vertices
	 */
	public int[] getSimplex( final int simplex )
	{
		return simplices[ simplex ].clone();
	}

	/**
	 * @return index of the simplex containing (x, y), or -1 if the position is outside of the triangulation
	 */
	public int findSimplex( final double x, final double y )
	{
		final Coordinate query = new Coordinate( x * precisionFactor, y * precisionFactor );

		int found = -1;
		for ( final Object candidate : simplicesTree.query( new Envelope( query ) ) )
		{
			final int s = ( Integer ) candidate;
			if ( ( found == -1 || s < found ) && contains( simplices[ s ], query ) )
				found = s;
		}
		return found;
	}

	/**
	 * @param positions
	 * 			query positions as [x, y]
	 */
	public int[] findSimplices( final double[][] positions )
	{
		final int[] found = new int[ positions.length ];
		for ( int q = 0; q < positions.length; ++q )
			found[ q ] = findSimplex( positions[ q ][ 0 ], positions[ q ][ 1 ] );
		return found;
	}

	/**
	 * @return index of the sample point closest to (x, y)
	 */
	public int findNearest( final double x, final double y )
	{
		final NearestNeighborSearchOnKDTree< Integer > search = new NearestNeighborSearchOnKDTree<>( kdTree );
		search.search( new RealPoint( x * precisionFactor, y * precisionFactor ) );
		return search.getSampler().get();
	}

	public int[] findNearest( final double[][] positions )
	{
		final NearestNeighborSearchOnKDTree< Integer > search = new NearestNeighborSearchOnKDTree<>( kdTree );
		final RealPoint query = new RealPoint( 2 );
		final int[] found = new int[ positions.length ];
		for ( int q = 0; q < positions.length; ++q )
		{
			query.setPosition( positions[ q ][ 0 ] * precisionFactor, 0 );
			query.setPosition( positions[ q ][ 1 ] * precisionFactor, 1 );
			search.search( query );
			found[ q ] = search.getSampler().get();
		}
		return found;
	}

	private boolean contains( final int[] simplex, final Coordinate query )
	{
		final Coordinate a = scaledPoints.get( simplex[ 0 ] ), b = scaledPoints.get( simplex[ 1 ] ), c = scaledPoints.get( simplex[ 2 ] );
		final int o1 = Orientation.index( a, b, query );
		final int o2 = Orientation.index( b, c, query );
		final int o3 = Orientation.index( c, a, query );

		final boolean hasClockwise = o1 == Orientation.CLOCKWISE || o2 == Orientation.CLOCKWISE || o3 == Orientation.CLOCKWISE;
		final boolean hasCounterClockwise = o1 == Orientation.COUNTERCLOCKWISE || o2 == Orientation.COUNTERCLOCKWISE || o3 == Orientation.COUNTERCLOCKWISE;
		return !( hasClockwise && hasCounterClockwise );
	}
}

package org.stereodsm.dataaccess;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.DoubleArrayDataBlock;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.stereodsm.data.DenseTile;
import org.stereodsm.data.SparseTile;
import org.stereodsm.tiling.Box;

import com.google.gson.reflect.TypeToken;

/**
 * Stores single tiles as N5 containers on the filesystem.
 *
 * A dense tile is a container with one 2D FLOAT64 dataset per band under {@code bands/}, a sparse tile
 * one 1D FLOAT64 dataset per column under {@code columns/}. Each dataset is a single uncompressed block,
 * so values are restored bit for bit. Names, sizes and tile attributes are root attributes.
 */
public class N5TileSerializer
{
	private static final String BANDS_GROUP = "bands";
	private static final String COLUMNS_GROUP = "columns";

	private static final String WINDOW_KEY = "window";
	private static final String WIDTH_KEY = "width";
	private static final String HEIGHT_KEY = "height";
	private static final String BAND_NAMES_KEY = "bandNames";
	private static final String NUM_POINTS_KEY = "numPoints";
	private static final String COLUMN_NAMES_KEY = "columnNames";
	private static final String ATTRIBUTES_KEY = "tileAttributes";

	private static final Type ATTRIBUTES_TYPE = new TypeToken< LinkedHashMap< String, Double > >() {}.getType();

	public static void saveDenseTile( final DenseTile tile, final String path ) throws IOException
	{
		final N5Writer n5 = new N5FSWriter( path );
		if ( tile.getWindow() != null )
			n5.setAttribute( "/", WINDOW_KEY, tile.getWindow().toArray() );
		n5.setAttribute( "/", WIDTH_KEY, tile.getWidth() );
		n5.setAttribute( "/", HEIGHT_KEY, tile.getHeight() );
		n5.setAttribute( "/", BAND_NAMES_KEY, tile.getBandNames().toArray( new String[ 0 ] ) );
		n5.setAttribute( "/", ATTRIBUTES_KEY, new LinkedHashMap<>( tile.getAttributes() ) );

		if ( ( long ) tile.getWidth() * tile.getHeight() == 0 )
			return;

		for ( final String band : tile.getBandNames() )
			writeSingleBlock( n5, BANDS_GROUP + "/" + band, new int[] { tile.getWidth(), tile.getHeight() }, tile.getBand( band ) );
	}

	public static DenseTile loadDenseTile( final String path ) throws IOException
	{
		final N5Reader n5 = openReader( path );
		final double[] window = n5.getAttribute( "/", WINDOW_KEY, double[].class );
		final int width = n5.getAttribute( "/", WIDTH_KEY, Integer.class );
		final int height = n5.getAttribute( "/", HEIGHT_KEY, Integer.class );

		final DenseTile tile = new DenseTile( window != null ? Box.fromArray( window ) : null, width, height );
		for ( final String band : n5.getAttribute( "/", BAND_NAMES_KEY, String[].class ) )
			tile.addBand( band, ( long ) width * height == 0 ? new double[ 0 ] : readSingleBlock( n5, BANDS_GROUP + "/" + band ) );

		for ( final Entry< String, Double > attribute : loadAttributes( n5 ).entrySet() )
			tile.setAttribute( attribute.getKey(), attribute.getValue() );

		return tile;
	}

	public static void saveSparseTile( final SparseTile tile, final String path ) throws IOException
	{
		final N5Writer n5 = new N5FSWriter( path );
		n5.setAttribute( "/", NUM_POINTS_KEY, tile.getNumPoints() );
		n5.setAttribute( "/", COLUMN_NAMES_KEY, tile.getColumnNames().toArray( new String[ 0 ] ) );
		n5.setAttribute( "/", ATTRIBUTES_KEY, new LinkedHashMap<>( tile.getAttributes() ) );

		if ( tile.getNumPoints() == 0 )
			return;

		for ( final String column : tile.getColumnNames() )
			writeSingleBlock( n5, COLUMNS_GROUP + "/" + column, new int[] { tile.getNumPoints() }, tile.getColumn( column ) );
	}

	public static SparseTile loadSparseTile( final String path ) throws IOException
	{
		final N5Reader n5 = openReader( path );
		final int numPoints = n5.getAttribute( "/", NUM_POINTS_KEY, Integer.class );

		final SparseTile tile = new SparseTile( numPoints );
		for ( final String column : n5.getAttribute( "/", COLUMN_NAMES_KEY, String[].class ) )
			tile.addColumn( column, numPoints == 0 ? new double[ 0 ] : readSingleBlock( n5, COLUMNS_GROUP + "/" + column ) );

		for ( final Entry< String, Double > attribute : loadAttributes( n5 ).entrySet() )
			tile.setAttribute( attribute.getKey(), attribute.getValue() );

		return tile;
	}

	private static N5Reader openReader( final String path ) throws IOException
	{
		if ( !Files.isDirectory( Paths.get( path ) ) )
			throw new IOException( "No tile stored at " + path );
		return new N5FSReader( path );
	}

	private static Map< String, Double > loadAttributes( final N5Reader n5 ) throws IOException
	{
		final Map< String, Double > attributes = n5.getAttribute( "/", ATTRIBUTES_KEY, ATTRIBUTES_TYPE );
		return attributes != null ? attributes : new LinkedHashMap<>();
	}

	private static void writeSingleBlock( final N5Writer n5, final String dataset, final int[] size, final double[] values ) throws IOException
	{
		final long[] dimensions = new long[ size.length ];
		for ( int d = 0; d < size.length; ++d )
			dimensions[ d ] = size[ d ];

		n5.createDataset( dataset, dimensions, size, DataType.FLOAT64, new RawCompression() );
		final DatasetAttributes datasetAttributes = n5.getDatasetAttributes( dataset );
		n5.writeBlock( dataset, datasetAttributes, new DoubleArrayDataBlock( size, new long[ size.length ], values ) );
	}

	private static double[] readSingleBlock( final N5Reader n5, final String dataset ) throws IOException
	{
		final DatasetAttributes datasetAttributes = n5.getDatasetAttributes( dataset );
		final DataBlock< ? > block = n5.readBlock( dataset, datasetAttributes, new long[ datasetAttributes.getNumDimensions() ] );
		if ( block == null )
			throw new IOException( "Missing data block in " + dataset );
		return ( double[] ) block.getData();
	}
}

package org.stereodsm.orchestration.wrapper;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.stereodsm.data.DenseTile;
import org.stereodsm.data.SparseTile;
import org.stereodsm.orchestration.TaskFunction;
import org.stereodsm.tiling.Box;

public class DiskWrapperTest
{
	@Rule
	public TemporaryFolder tmpFolder = new TemporaryFolder();

	private DiskWrapper wrapper;

	@Before
	public void setUp()
	{
		wrapper = new DiskWrapper( tmpFolder.getRoot().getAbsolutePath() );
	}

	private static DenseTile denseTile()
	{
		return new DenseTile( new Box( 100, 200, 103, 202 ), 3, 2 )
				.addBand( "im", new double[] { 0.1, -0.0, Double.NaN, Double.MAX_VALUE, Double.MIN_VALUE, 1e-300 } )
				.addBand( "msk", new double[] { 255, 0, 0, 255, 255, 0 } )
				.setAttribute( "no_data", -32768 );
	}

	private static SparseTile sparseTile()
	{
		return new SparseTile( 3 )
				.addColumn( SparseTile.X, new double[] { 651000.125, 651001.5, Double.NEGATIVE_INFINITY } )
				.addColumn( SparseTile.Y, new double[] { 4832000.25, 4832001.75, 0.3 } )
				.addColumn( SparseTile.Z, new double[] { 12.000000001, Double.NaN, 1.0 / 3 } )
				.setAttribute( "epi_id", 4 );
	}

	private static void assertBitwiseEquals( final double[] expected, final double[] actual )
	{
		Assert.assertEquals( expected.length, actual.length );
		for ( int i = 0; i < expected.length; ++i )
			Assert.assertEquals( Double.doubleToRawLongBits( expected[ i ] ), Double.doubleToRawLongBits( actual[ i ] ) );
	}

	@Test
	public void testDumpAndLoadDense() throws IOException
	{
		wrapper.init();
		final DenseTile tile = denseTile();
		final DumpedHandle handle = DiskWrapper.dump( tile, wrapper.getTmpDir(), 0 );
		Assert.assertEquals( HandleKind.DENSE, handle.getKind() );
		Assert.assertEquals( new File( wrapper.getTmpDir(), "DenseDO_0" ).getPath(), handle.getPath() );

		final DenseTile loaded = ( DenseTile ) wrapper.getObject( handle );
		Assert.assertEquals( tile.getWindow(), loaded.getWindow() );
		Assert.assertEquals( tile.getBandNames(), loaded.getBandNames() );
		for ( final String band : tile.getBandNames() )
			assertBitwiseEquals( tile.getBand( band ), loaded.getBand( band ) );
		Assert.assertEquals( tile.getAttributes(), loaded.getAttributes() );
	}

	@Test
	public void testDumpAndLoadSparse() throws IOException
	{
		wrapper.init();
		final SparseTile tile = sparseTile();
		final DumpedHandle handle = DiskWrapper.dump( tile, wrapper.getTmpDir(), 7 );
		Assert.assertEquals( new File( wrapper.getTmpDir(), "SparseDO_7" ).getPath(), handle.getPath() );

		final SparseTile loaded = ( SparseTile ) wrapper.getObject( handle );
		Assert.assertEquals( tile.getColumnNames(), loaded.getColumnNames() );
		for ( final String column : tile.getColumnNames() )
			assertBitwiseEquals( tile.getColumn( column ), loaded.getColumn( column ) );
		Assert.assertEquals( tile.getAttributes(), loaded.getAttributes() );
	}

	@Test
	public void testEmptyTiles() throws IOException
	{
		wrapper.init();
		final SparseTile noPoints = new SparseTile( 0 ).addColumn( SparseTile.X, new double[ 0 ] );
		Assert.assertEquals( noPoints, wrapper.getObject( DiskWrapper.dump( noPoints, wrapper.getTmpDir(), 0 ) ) );

		final DenseTile noPixels = new DenseTile( null, 0, 4 ).addBand( "im", new double[ 0 ] );
		Assert.assertEquals( noPixels, wrapper.getObject( DiskWrapper.dump( noPixels, wrapper.getTmpDir(), 1 ) ) );
	}

	@Test( expected = SchemaMismatchException.class )
	public void testSchemaMismatch() throws IOException
	{
		wrapper.init();
		DiskWrapper.dump( "not a tile", wrapper.getTmpDir(), 0 );
	}

	@Test
	public void testWrappedFunction() throws Exception
	{
		wrapper.init();

		final TaskFunction makeTile = args -> sparseTile();
		final TaskFunction countPoints = args -> new SparseTile( 0 ).setAttribute( "count", ( ( SparseTile ) args[ 0 ] ).getNumPoints() );

		final Object first = wrapper.wrapFunction( makeTile, 1 ).apply();
		Assert.assertTrue( DumpedHandle.isDumpedObject( first ) );
		Assert.assertEquals( new File( wrapper.getTmpDir(), "SparseDO_0" ).getPath(), ( ( DumpedHandle ) first ).getPath() );

		final Object second = wrapper.wrapFunction( countPoints, 1 ).apply( first );
		Assert.assertEquals( new File( wrapper.getTmpDir(), "SparseDO_1" ).getPath(), ( ( DumpedHandle ) second ).getPath() );
		Assert.assertEquals( 3.0, ( ( SparseTile ) wrapper.getObject( second ) ).getAttributes().get( "count" ), 0 );
	}

	@Test
	public void testIdsAreMonotonic() throws Exception
	{
		wrapper.init();
		final TaskFunction makeTiles = args -> Arrays.asList( sparseTile(), null, denseTile() );

		final TaskFunction wrappedFirst = wrapper.wrapFunction( makeTiles, 3 );
		final TaskFunction wrappedSecond = wrapper.wrapFunction( args -> sparseTile(), 1 );

		// execution order does not change the ids
		final DumpedHandle single = ( DumpedHandle ) wrappedSecond.apply();
		final Object[] handles = ( Object[] ) wrappedFirst.apply();

		Assert.assertEquals( new File( wrapper.getTmpDir(), "SparseDO_3" ).getPath(), single.getPath() );
		Assert.assertEquals( new File( wrapper.getTmpDir(), "SparseDO_0" ).getPath(), ( ( DumpedHandle ) handles[ 0 ] ).getPath() );
		Assert.assertNull( handles[ 1 ] );
		Assert.assertEquals( new File( wrapper.getTmpDir(), "DenseDO_2" ).getPath(), ( ( DumpedHandle ) handles[ 2 ] ).getPath() );
		Assert.assertFalse( new File( wrapper.getTmpDir(), "SparseDO_1" ).exists() );
	}

	@Test
	public void testListArgumentsAreLoaded() throws Exception
	{
		wrapper.init();
		final DumpedHandle handle = DiskWrapper.dump( sparseTile(), wrapper.getTmpDir(), 0 );

		final Object loaded = DiskWrapper.loadArg( Arrays.asList( handle, Arrays.asList( handle ), "other" ) );
		final List< ? > list = ( List< ? > ) loaded;
		Assert.assertEquals( sparseTile(), list.get( 0 ) );
		Assert.assertEquals( Arrays.asList( sparseTile() ), list.get( 1 ) );
		Assert.assertEquals( "other", list.get( 2 ) );
	}

	@Test
	public void testNonHandleIsReturned() throws IOException
	{
		wrapper.init();
		Assert.assertEquals( "value", wrapper.getObject( "value" ) );
		Assert.assertNull( wrapper.getObject( null ) );
	}

	@Test
	public void testLifecycle() throws IOException
	{
		Assert.assertEquals( WrapperState.UNINITIALIZED, wrapper.getState() );
		try
		{
			wrapper.wrapFunction( args -> null, 1 );
			Assert.fail( "wrapped a function before init" );
		}
		catch ( final HandleLifecycleException e ) {}

		wrapper.init();
		Assert.assertEquals( WrapperState.ACTIVE, wrapper.getState() );
		Assert.assertTrue( new File( wrapper.getTmpDir() ).isDirectory() );
		try
		{
			wrapper.init();
			Assert.fail( "initialized twice" );
		}
		catch ( final HandleLifecycleException e ) {}

		final DumpedHandle handle = DiskWrapper.dump( sparseTile(), wrapper.getTmpDir(), 0 );

		wrapper.cleanup();
		Assert.assertEquals( WrapperState.CLEANED, wrapper.getState() );
		Assert.assertFalse( new File( wrapper.getTmpDir() ).exists() );
		wrapper.cleanup();

		try
		{
			wrapper.getObject( handle );
			Assert.fail( "loaded a tile after cleanup" );
		}
		catch ( final HandleLifecycleException e ) {}

		try
		{
			DiskWrapper.load( handle );
			Assert.fail( "loaded a removed tile" );
		}
		catch ( final HandleLifecycleException e ) {}

		try
		{
			wrapper.wrapFunction( args -> null, 1 );
			Assert.fail( "wrapped a function after cleanup" );
		}
		catch ( final HandleLifecycleException e ) {}
	}

	@Test
	public void testSubstitutableWithNoneWrapper() throws Exception
	{
		wrapper.init();
		final NoneWrapper none = new NoneWrapper();
		final TaskFunction func = args -> new SparseTile( 1 ).addColumn( SparseTile.X, new double[] { ( Double ) args[ 0 ] * 2 } );

		final Object inMemory = none.getObject( none.wrapFunction( func, 1 ).apply( 1.5 ) );
		final Object onDisk = wrapper.getObject( wrapper.wrapFunction( func, 1 ).apply( 1.5 ) );
		Assert.assertEquals( inMemory, onDisk );
	}

	@Test
	public void testHandleFromPath()
	{
		Assert.assertEquals( new DumpedHandle( HandleKind.DENSE, "/tmp/run/tmp/DenseDO_12" ), DumpedHandle.fromPath( "/tmp/run/tmp/DenseDO_12" ) );
		Assert.assertEquals( HandleKind.SPARSE, DumpedHandle.fromPath( "/tmp/SparseDO_3" ).getKind() );
		Assert.assertNull( DumpedHandle.fromPath( "/tmp/other_3" ) );
		Assert.assertFalse( DumpedHandle.isDumpedObject( "/tmp/run/tmp/DenseDO_12" ) );
	}
}

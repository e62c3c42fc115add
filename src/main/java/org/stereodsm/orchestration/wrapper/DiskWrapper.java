package org.stereodsm.orchestration.wrapper;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.data.DenseTile;
import org.stereodsm.data.SparseTile;
import org.stereodsm.dataaccess.N5TileSerializer;
import org.stereodsm.orchestration.Task;
import org.stereodsm.orchestration.TaskFunction;

/**
 * Keeps tile values on disk between tasks: task outputs are dumped to the wrapper's temporary directory
 * and replaced by {@link DumpedHandle}s, and handles received as task arguments are loaded back
 * before the task function runs.
 *
 * Output ids are issued by the wrapper instance when a task is called, so they are unique within
 * the instance whatever backend runs the tasks.
 */
public class DiskWrapper implements TileWrapper
{
	private static final Logger LOG = LoggerFactory.getLogger( DiskWrapper.class );

	public static final String TMP_FOLDER = "tmp";

	private final String tmpDir;
	private final AtomicLong currentObjectId = new AtomicLong();
	private volatile WrapperState state = WrapperState.UNINITIALIZED;

	/**
	 * @param baseDir
	 * 			folder in which the wrapper creates its temporary directory
	 */
	public DiskWrapper( final String baseDir )
	{
		this.tmpDir = Paths.get( baseDir, TMP_FOLDER ).toString();
	}

	public String getTmpDir()
	{
		return tmpDir;
	}

	public WrapperState getState()
	{
		return state;
	}

	public synchronized void init() throws IOException
	{
		if ( state != WrapperState.UNINITIALIZED )
			throw new HandleLifecycleException( "Disk wrapper is already " + state );

		Files.createDirectories( Paths.get( tmpDir ) );
		state = WrapperState.ACTIVE;
		LOG.info( "Dumping tiles to {}", tmpDir );
	}

	@Override
	public TaskFunction wrapFunction( final TaskFunction func, final int nout )
	{
		requireActive();

		final long[] ids = new long[ nout ];
		for ( int i = 0; i < nout; ++i )
			ids[ i ] = currentObjectId.getAndIncrement();

		return new DiskWrappedFunction( func, tmpDir, ids );
	}

	@Override
	public Object getObject( final Object obj )
	{
		if ( state == WrapperState.CLEANED )
			throw new HandleLifecycleException( "Cannot load " + obj + ", the disk wrapper was cleaned up" );

		if ( obj == null )
			return null;

		if ( !DumpedHandle.isDumpedObject( obj ) )
		{
			LOG.warn( "Not a dumped arrays or points: {}", obj );
			return obj;
		}

		return load( ( DumpedHandle ) obj );
	}

	@Override
	public synchronized void cleanup()
	{
		if ( state == WrapperState.CLEANED )
			return;

		LOG.info( "Clean tmp directory {}", tmpDir );
		final Path dir = Paths.get( tmpDir );
		if ( Files.exists( dir ) )
		{
			try
			{
				deleteFolder( dir );
			}
			catch ( final IOException e )
			{
				throw new HandleLifecycleException( "Cannot remove " + tmpDir, e );
			}
		}
		state = WrapperState.CLEANED;
	}

	/**
	 * Loads a dumped tile. Fails if the tile does not exist anymore.
	 */
	public static Object load( final DumpedHandle handle )
	{
		if ( !Files.isDirectory( Paths.get( handle.getPath() ) ) )
			throw new HandleLifecycleException( "Dumped tile " + handle + " does not exist, its wrapper may have been cleaned up" );

		try
		{
			switch ( handle.getKind() )
			{
			case DENSE:
				return N5TileSerializer.loadDenseTile( handle.getPath() );
			case SPARSE:
				return N5TileSerializer.loadSparseTile( handle.getPath() );
			default:
				throw new SchemaMismatchException( "Unknown handle kind " + handle.getKind() );
			}
		}
		catch ( final IOException e )
		{
			throw new HandleLifecycleException( "Cannot load dumped tile " + handle, e );
		}
	}

	/**
	 * Dumps a tile under {@code dir} with the given id.
	 *
	 * @throws SchemaMismatchException if {@code value} is neither a {@link DenseTile} nor a {@link SparseTile}
	 */
	public static DumpedHandle dump( final Object value, final String dir, final long id ) throws IOException
	{
		final HandleKind kind = HandleKind.of( value );
		final DumpedHandle handle = DumpedHandle.create( kind, dir, id );
		if ( kind == HandleKind.DENSE )
			N5TileSerializer.saveDenseTile( ( DenseTile ) value, handle.getPath() );
		else
			N5TileSerializer.saveSparseTile( ( SparseTile ) value, handle.getPath() );
		return handle;
	}

	/**
	 * Replaces handles by their tiles, recursively through lists.
	 */
	static Object loadArg( final Object arg )
	{
		if ( DumpedHandle.isDumpedObject( arg ) )
			return load( ( DumpedHandle ) arg );

		if ( arg instanceof List )
		{
			final List< ? > list = ( List< ? > ) arg;
			final List< Object > loaded = new ArrayList<>( list.size() );
			for ( final Object element : list )
				loaded.add( loadArg( element ) );
			return loaded;
		}

		return arg;
	}

	private void requireActive()
	{
		if ( state != WrapperState.ACTIVE )
			throw new HandleLifecycleException( "Disk wrapper is " + state + ", expected " + WrapperState.ACTIVE );
	}

	private static void deleteFolder( final Path dir ) throws IOException
	{
		Files.walkFileTree( dir, new SimpleFileVisitor< Path >()
			{
				@Override
				public FileVisitResult visitFile( final Path file, final BasicFileAttributes attrs ) throws IOException
				{
					Files.delete( file );
					return FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult postVisitDirectory( final Path visitedDir, final IOException exc ) throws IOException
				{
					Files.delete( visitedDir );
					return FileVisitResult.CONTINUE;
				}
			}
		);
	}

	private static class DiskWrappedFunction implements TaskFunction
	{
		private static final long serialVersionUID = 3047011623938006474L;

		private final TaskFunction func;
		private final String tmpDir;
		private final long[] ids;

		DiskWrappedFunction( final TaskFunction func, final String tmpDir, final long[] ids )
		{
			this.func = func;
			this.tmpDir = tmpDir;
			this.ids = ids;
		}

		@Override
		public Object apply( final Object... args ) throws Exception
		{
			final Object[] loadedArgs = new Object[ args.length ];
			for ( int i = 0; i < args.length; ++i )
				loadedArgs[ i ] = loadArg( args[ i ] );

			final Object result = func.apply( loadedArgs );
			if ( result == null )
				return null;

			if ( ids.length == 1 )
				return dump( result, tmpDir, ids[ 0 ] );

			final Object[] outputs = Task.splitOutputs( result, ids.length );
			final Object[] handles = new Object[ ids.length ];
			for ( int i = 0; i < ids.length; ++i )
				handles[ i ] = outputs[ i ] == null ? null : dump( outputs[ i ], tmpDir, ids[ i ] );
			return handles;
		}
	}
}

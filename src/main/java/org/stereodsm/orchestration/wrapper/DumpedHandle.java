package org.stereodsm.orchestration.wrapper;

import java.io.File;
import java.io.Serializable;

/**
 * Reference to a tile dumped on disk at {@code <dir>/<marker>_<id>}.
 */
public class DumpedHandle implements Serializable
{
	private static final long serialVersionUID = -5211585460962506395L;

	private final HandleKind kind;
	private final String path;

	public DumpedHandle( final HandleKind kind, final String path )
	{
		this.kind = kind;
		this.path = path;
	}

	public static DumpedHandle create( final HandleKind kind, final String dir, final long id )
	{
		return new DumpedHandle( kind, new File( dir, kind.getMarker() + "_" + id ).getPath() );
	}

	/**
	 * Recovers a handle from its path: any path containing a dense or sparse marker is a handle.
	 *
	 * @return the handle, or {@code null} if the path has no marker
	 */
	public static DumpedHandle fromPath( final String path )
	{
		for ( final HandleKind kind : HandleKind.values() )
			if ( path.contains( kind.getMarker() ) )
				return new DumpedHandle( kind, path );
		return null;
	}

	public static boolean isDumpedObject( final Object obj )
	{
		return obj instanceof DumpedHandle;
	}

	public HandleKind getKind()
	{
		return kind;
	}

	public String getPath()
	{
		return path;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof DumpedHandle ) )
			return false;
		final DumpedHandle other = ( DumpedHandle ) obj;
		return kind == other.kind && path.equals( other.path );
	}

	@Override
	public int hashCode()
	{
		return 31 * kind.hashCode() + path.hashCode();
	}

	@Override
	public String toString()
	{
		return path;
	}
}

package org.stereodsm.orchestration;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import org.stereodsm.orchestration.wrapper.DiskWrapper;
import org.stereodsm.orchestration.wrapper.NoneWrapper;
import org.stereodsm.orchestration.wrapper.TileWrapper;

/**
 * Creates the cluster backend selected by a {@link ClusterConfiguration}.
 */
public abstract class ClusterFactory
{
	private static final String APP_NAME = "StereoTiling";

	private static final Map< String, BiFunction< ClusterConfiguration, TileWrapper, Cluster > > REGISTRY = new LinkedHashMap<>();

	static
	{
		register( ClusterConfiguration.SEQUENTIAL, ( conf, wrapper ) -> new SequentialCluster( wrapper ) );
		register( ClusterConfiguration.MULTITHREADED, ( conf, wrapper ) -> new MultithreadedCluster( wrapper, conf.getNbWorkers() ) );
		register( ClusterConfiguration.SPARK, ( conf, wrapper ) -> new SparkCluster( wrapper, conf.getSparkMaster(), APP_NAME ) );
	}

	public static synchronized void register( final String mode, final BiFunction< ClusterConfiguration, TileWrapper, Cluster > constructor )
	{
		REGISTRY.put( mode, constructor );
	}

	public static synchronized boolean isRegistered( final String mode )
	{
		return REGISTRY.containsKey( mode );
	}

	public static synchronized List< String > registeredModes()
	{
		return new ArrayList<>( REGISTRY.keySet() );
	}

	public static Cluster create( final ClusterConfiguration conf ) throws IOException
	{
		conf.checkConf();

		final BiFunction< ClusterConfiguration, TileWrapper, Cluster > constructor;
		synchronized ( ClusterFactory.class )
		{
			constructor = REGISTRY.get( conf.getMode() );
		}
		return constructor.apply( conf, createWrapper( conf ) );
	}

	public static TileWrapper createWrapper( final ClusterConfiguration conf ) throws IOException
	{
		if ( ClusterConfiguration.WRAPPER_DISK.equals( conf.getWrapper() ) )
		{
			final DiskWrapper wrapper = new DiskWrapper( conf.getTmpDir() );
			wrapper.init();
			return wrapper;
		}
		return new NoneWrapper();
	}
}

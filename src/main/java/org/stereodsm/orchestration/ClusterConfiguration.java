package org.stereodsm.orchestration;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Cluster settings, read from a JSON object such as
 * <pre>{ "mode": "multithreaded", "nb_workers": 4, "wrapper": "disk", "tmp_dir": "/scratch/run" }</pre>
 */
public class ClusterConfiguration
{
	public static final String SEQUENTIAL = "sequential";
	public static final String MULTITHREADED = "multithreaded";
	public static final String SPARK = "spark";

	public static final String WRAPPER_NONE = "none";
	public static final String WRAPPER_DISK = "disk";

	public static final int DEFAULT_NB_WORKERS = 2;

	private String mode;
	private Integer nbWorkers;
	private String wrapper;
	private String tmpDir;
	private String sparkMaster;

	public String getMode() { return mode; }
	public Integer getNbWorkers() { return nbWorkers; }
	public String getWrapper() { return wrapper; }
	public String getTmpDir() { return tmpDir; }
	public String getSparkMaster() { return sparkMaster; }

	public ClusterConfiguration setMode( final String mode ) { this.mode = mode; return this; }
	public ClusterConfiguration setNbWorkers( final Integer nbWorkers ) { this.nbWorkers = nbWorkers; return this; }
	public ClusterConfiguration setWrapper( final String wrapper ) { this.wrapper = wrapper; return this; }
	public ClusterConfiguration setTmpDir( final String tmpDir ) { this.tmpDir = tmpDir; return this; }
	public ClusterConfiguration setSparkMaster( final String sparkMaster ) { this.sparkMaster = sparkMaster; return this; }

	/**
	 * Fills the defaults and validates the settings.
	 *
	 * @return this configuration
	 * @throws IllegalArgumentException naming the first invalid setting
	 */
	public ClusterConfiguration checkConf()
	{
		if ( mode == null )
			mode = SEQUENTIAL;
		if ( !ClusterFactory.isRegistered( mode ) )
			throw new IllegalArgumentException( "mode: unknown cluster mode '" + mode + "', expected one of " + ClusterFactory.registeredModes() );

		if ( nbWorkers == null )
			nbWorkers = DEFAULT_NB_WORKERS;
		if ( nbWorkers <= 0 )
			throw new IllegalArgumentException( "nb_workers: should be positive, got " + nbWorkers );

		if ( wrapper == null )
			wrapper = SEQUENTIAL.equals( mode ) ? WRAPPER_NONE : WRAPPER_DISK;
		if ( !WRAPPER_NONE.equals( wrapper ) && !WRAPPER_DISK.equals( wrapper ) )
			throw new IllegalArgumentException( "wrapper: expected '" + WRAPPER_NONE + "' or '" + WRAPPER_DISK + "', got '" + wrapper + "'" );
		if ( WRAPPER_DISK.equals( wrapper ) && ( tmpDir == null || tmpDir.isEmpty() ) )
			throw new IllegalArgumentException( "tmp_dir: required by the disk wrapper" );

		if ( SPARK.equals( mode ) && sparkMaster == null )
			sparkMaster = "local[" + nbWorkers + "]";

		return this;
	}

	public static ClusterConfiguration load( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final ClusterConfiguration conf = createGson().fromJson( closeableReader, ClusterConfiguration.class );
			return conf != null ? conf : new ClusterConfiguration();
		}
	}

	public static void save( final ClusterConfiguration conf, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( conf ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.setFieldNamingPolicy( FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES )
				.setPrettyPrinting()
				.create();
	}
}

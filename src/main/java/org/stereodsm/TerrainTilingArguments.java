package org.stereodsm;

import java.io.Serializable;
import java.nio.file.Paths;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for a terrain tiling job.
 */
public class TerrainTilingArguments implements Serializable
{
	private static final long serialVersionUID = -4710208226017624535L;

	@Option(name = "-i", aliases = { "--input" }, required = true,
			usage = "Path to the planning input JSON file (terrain region of interest, resolution, tile size and stereo pairs).")
	private String inputPath;

	@Option(name = "-o", aliases = { "--output" }, required = false,
			usage = "Output folder for the candidate tiles and the GeoJSON files. Defaults to the folder of the input file.")
	private String outputPath;

	private boolean parsedSuccessfully = false;

	public TerrainTilingArguments( final String... args ) throws IllegalArgumentException
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try
		{
			parser.parseArgument( args );
			parsedSuccessfully = true;
		}
		catch ( final CmdLineException e )
		{
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
			return;
		}

		inputPath = Paths.get( inputPath ).toAbsolutePath().toString();
		if ( outputPath == null )
			outputPath = Paths.get( inputPath ).getParent().toString();
		else
			outputPath = Paths.get( outputPath ).toAbsolutePath().toString();
	}

	public String inputPath() { return inputPath; }
	public String outputPath() { return outputPath; }

	public boolean parsedSuccessfully() { return parsedSuccessfully; }
}

package org.lokray.checker.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the checker.
 * <p>
 * At most one export file may be given; without one the export is read from
 * standard input.
 */
public class CheckerArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean quietFlag = false;
	private boolean showBinders = false;
	private Path outputPath = null;

	// Private constructor, use parse()
	private CheckerArguments()
	{
	}

	public static CheckerArguments parse(String[] args)
	{
		CheckerArguments parsedArgs = new CheckerArguments();

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-q") || arg.equals("--quiet"))
				{
					parsedArgs.quietFlag = true;
					continue;
				}
				if (arg.equals("--show-binders"))
				{
					parsedArgs.showBinders = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Reads a Lean export file and prints what it declares.");
		System.out.println("\nUSAGE: lean-checker [options] [<export file path>]");
		System.out.println("       Reads standard input when no file is given.");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -q, --quiet               Do not print entries as they are read.");
		System.out.println("  --show-binders            Print the binders in scope after each binder.");
		System.out.println("  -o, --output <file>       Write a JSON summary of the declarations.");
	}

	/**
	 * @return true if more than one export file was given.
	 */
	public boolean hasTooManyInputs()
	{
		return inputFiles.size() > 1;
	}

	/**
	 * @return the export file, or null to read standard input.
	 */
	public Path getInputFile()
	{
		return inputFiles.isEmpty() ? null : inputFiles.get(0);
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isQuietFlag()
	{
		return quietFlag;
	}

	public boolean isShowBinders()
	{
		return showBinders;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}
}

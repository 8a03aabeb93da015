package org.lokray.checker;

import org.lokray.checker.environment.Environment;
import org.lokray.checker.parser.ExportParseException;
import org.lokray.checker.parser.ExportParser;
import org.lokray.checker.util.*;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: reads one export file (or standard input) and
 * reports whether every line could be applied.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * @return the process exit status.
	 */
	static int run(String[] args)
	{
		CheckerArguments arguments = CheckerArguments.parse(args);

		if (arguments.isHelpFlag() || arguments.hasTooManyInputs())
		{
			CheckerArguments.printUsage();
			return 0;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("lean-checker version " + VERSION);
			return 0;
		}

		ErrorHandler errorHandler = new ErrorHandler();
		Path inputFile = arguments.getInputFile();
		if (inputFile != null && !Files.isRegularFile(inputFile))
		{
			errorHandler.logError("Input file not found: " + inputFile);
			return 1;
		}

		String source = inputFile == null ? "<stdin>" : inputFile.toString();
		Environment env = new Environment(arguments.isShowBinders());
		if (!arguments.isQuietFlag())
		{
			env.addListener(new TracingListener());
		}

		ExportParser parser = new ExportParser(env);
		try (Reader reader = openInput(inputFile))
		{
			Debug.logDebug("Reading export from " + source);
			parser.parse(reader);
		}
		catch (ExportParseException e)
		{
			errorHandler.logError(e, source);
		}
		catch (IOException e)
		{
			errorHandler.logError("Error reading file: " + e.getMessage());
		}

		if (errorHandler.hasErrors())
		{
			Debug.logError("Processing aborted after " + parser.getLinesRead() + " line(s).");
			return 1;
		}

		Debug.logInfo(String.format("Read %d line(s): %d names, %d levels, %d expressions, %d declarations.",
				parser.getLinesRead(), env.nameCount(), env.levelCount(), env.exprCount(), env.declarationCount()));

		if (arguments.getOutputPath() != null)
		{
			try
			{
				EnvironmentDTOConverter.write(EnvironmentDTOConverter.toDTO(env, source), arguments.getOutputPath());
			}
			catch (IOException e)
			{
				errorHandler.logError("Failed to write summary: " + e.getMessage());
				return 1;
			}
		}
		return 0;
	}

	private static Reader openInput(Path inputFile) throws IOException
	{
		if (inputFile == null)
		{
			return new InputStreamReader(System.in, StandardCharsets.UTF_8.newDecoder());
		}
		return Files.newBufferedReader(inputFile, StandardCharsets.UTF_8);
	}
}

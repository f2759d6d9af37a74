package nl.utwente.ewi.fmt.SC2JANI;

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Convert
{
	private static final Logger log = LoggerFactory.getLogger(Convert.class);

	private static void usage(PrintStream out) {
		out.println("Usage: java -jar SC2JANI.jar --jani [options] <descriptor.json>");
		out.println("Options:");
		out.println("\t-o <file>                 Output file (default: <model name>.jani)");
		out.println("\t--def <name> <value>      Set the value of a model constant");
		out.println("\t--max-array-size <n>      Capacity of arrays declared without size");
		out.println("\t--random-options <n>      Number of values a random distribution is replaced by");
	}

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/** Run a conversion.
	 * @return The exit code.
	 */
	public static int run(String[] args)
	{
		if (args.length == 0 || !args[0].equals("--jani")) {
			if (args.length > 0 && (args[0].equals("-h") || args[0].equals("--help"))) {
				usage(System.out);
				return 0;
			}
			if (args.length > 0)
				System.err.println("Unknown conversion: " + args[0]);
			usage(System.err);
			return 1;
		}
		if (args.length < 2) {
			System.err.println("No model descriptor given");
			usage(System.err);
			return 1;
		}
		ConversionOptions options = new ConversionOptions();
		String filename = args[args.length - 1];
		try {
			for (int i = 1; i < args.length - 1; i++) {
				if (args[i].equals("-o")) {
					options.setOutput(argument(args, ++i));
				} else if (args[i].equals("--def")) {
					String name = argument(args, ++i);
					options.defineConstant(name, ConversionOptions.parseValue(argument(args, ++i)));
				} else if (args[i].equals("--max-array-size")) {
					options.setMaxArraySize(integer(argument(args, ++i)));
				} else if (args[i].equals("--random-options")) {
					options.setRandomOptions(integer(argument(args, ++i)));
				} else {
					System.err.format("Unknown option '%s'\n", args[i]);
					usage(System.err);
					return 1;
				}
			}
			ModelDescriptor descriptor = ModelDescriptor.read(filename);
			JaniModel model = descriptor.build(options);
			/* Serialize completely before creating the file. */
			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			PrintStream buffer = new PrintStream(bytes, false, StandardCharsets.UTF_8);
			model.writeJani(buffer);
			String output = options.getOutput(descriptor.name + ".jani");
			try (FileOutputStream out = new FileOutputStream(output)) {
				bytes.writeTo(out);
			}
			log.info("Wrote {}", output);
			return 0;
		} catch (CompilationException e) {
			System.err.println("Error: " + e.getMessage());
			return 2;
		} catch (IllegalArgumentException | UnsupportedOperationException e) {
			System.err.println("Invalid input: " + e.getMessage());
			return 2;
		} catch (IOException e) {
			System.err.println("I/O error: " + e.getMessage());
			return 3;
		}
	}

	private static String argument(String[] args, int i) {
		/* The last argument is the descriptor. */
		if (i >= args.length - 1)
			throw new ConfigurationException("Missing argument to " + args[i - 1]);
		return args[i];
	}

	private static int integer(String v) {
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Not an integer: " + v);
		}
	}
}

package edu.uw.easyconllu.main;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;

import edu.uw.easyconllu.alignment.SentenceAligner;
import edu.uw.easyconllu.corpora.Format;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.SentenceReader;
import edu.uw.easyconllu.corpora.SentenceWriter;
import edu.uw.easyconllu.util.FaultReport;
import edu.uw.easyconllu.util.Util;

public class EasyCoNLLU {

	static final String DEFAULT_PROPERTIES = "easyconllu.properties";

	/**
	 * Command Line Interface. Options left empty fall back to the properties file.
	 */
	public interface CommandLineArguments {
		@Option(shortName = "f", description = "Path to the input corpus. Files ending in .gz are decompressed.")
		String getInputFile();

		@Option(shortName = "o", defaultValue = "", description = "(Optional) Path to the output file. Otherwise, the corpus is written to stdout.")
		String getOutputFile();

		@Option(shortName = "i", defaultValue = "", description = "(Optional) Input format: one of \"conllu\" or \"proiel\". Defaults to conllu.")
		String getInputFormat();

		@Option(defaultValue = "", description = "(Optional) Output format: one of \"conllu\" or \"proiel\". Defaults to the input format; proiel input can be exported as conllu.")
		String getOutputFormat();

		@Option(shortName = "s", defaultValue = "", description = "(Optional) Comma-separated stages to run, in order: exclamation, multiword-lemma, punctuation-inference, empty-tokens, obl-relations, multiple-roots.")
		String getStages();

		@Option(shortName = "p", defaultValue = "", description = "(Optional) A parsed CoNLL-U version of the input, whose heads, relations and readings are merged into it before the stages run.")
		String getParsed();

		@Option(defaultValue = "", description = "(Optional) Properties file with default settings.")
		String getProperties();

		@Option(defaultValue = "", description = "(Optional) Also write progress messages to this file.")
		String getLogFile();

		@Option(description = "Drop malformed lines instead of keeping them verbatim.")
		boolean getStrict();

		@Option(description = "Report sentences whose heads form a cycle.")
		boolean getCheckCycles();

		@Option(shortName = "v", description = "List every fault, not just the counts.")
		boolean getVerbose();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	public static void main(final String[] args) throws IOException {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final Properties properties = commandLineOptions.getProperties().isEmpty() ? Util
					.loadPropertiesFromClasspath(DEFAULT_PROPERTIES) : Util.loadProperties(Util
					.getFile(commandLineOptions.getProperties()));

			final Format inputFormat = Format.valueOf(setting(commandLineOptions.getInputFormat(), properties,
					"inputFormat", "conllu").toUpperCase());
			final Format outputFormat = Format.valueOf(setting(commandLineOptions.getOutputFormat(), properties,
					"outputFormat", inputFormat.name()).toUpperCase());
			if (inputFormat != outputFormat && inputFormat != Format.PROIEL) {
				throw new IllegalArgumentException("Cannot write " + inputFormat + " input as " + outputFormat);
			}
			final boolean strict = commandLineOptions.getStrict()
					|| Boolean.parseBoolean(properties.getProperty("strict", "false"));
			final boolean checkCycles = commandLineOptions.getCheckCycles()
					|| Boolean.parseBoolean(properties.getProperty("checkCycles", "false"));
			final String logFile = setting(commandLineOptions.getLogFile(), properties, "logFile", "");
			final Util.Logger logger = logFile.isEmpty() ? new Util.Logger() : new Util.Logger(Util.getFile(logFile));

			final FaultReport faults = new FaultReport();
			final SentenceReader.Mode mode = strict ? SentenceReader.Mode.STRICT : SentenceReader.Mode.LENIENT;
			final Pipeline pipeline = new Pipeline(Pipeline.makeStages(
					setting(commandLineOptions.getStages(), properties, "stages", ""), properties), inputFormat,
					checkCycles, faults);

			final Stopwatch timer = Stopwatch.createStarted();
			final File inputFile = Util.getFile(commandLineOptions.getInputFile());
			logger.log("Reading " + inputFile);
			List<Sentence> corpus = SentenceReader.make(inputFormat, mode, faults).readAll(
					Util.readFileLineByLine(inputFile));

			if (!commandLineOptions.getParsed().isEmpty()) {
				if (inputFormat != Format.CONLLU) {
					throw new IllegalArgumentException("Only CoNLL-U input can be aligned with a parse");
				}
				final List<Sentence> parsed = SentenceReader.make(Format.CONLLU, mode, faults).readAll(
						Util.readFileLineByLine(Util.getFile(commandLineOptions.getParsed())));
				final int aligned = new SentenceAligner().align(corpus, parsed, faults);
				logger.log("Aligned " + aligned + " of " + corpus.size() + " sentences"
						+ (corpus.isEmpty() ? "" : " (" + Util.percentage(aligned, corpus.size()) + ")"));
			}

			logger.log("Running stages on " + corpus.size() + " sentences");
			pipeline.processCorpus(corpus);
			if (inputFormat == Format.PROIEL && outputFormat == Format.CONLLU) {
				corpus = pipeline.export(corpus);
			}

			final SentenceWriter writer = SentenceWriter.make(outputFormat);
			if (commandLineOptions.getOutputFile().isEmpty()) {
				final Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
				for (final Sentence sentence : corpus) {
					writer.write(sentence, out);
				}
				out.flush();
			} else {
				writer.writeFile(corpus, Util.getFile(commandLineOptions.getOutputFile()));
			}

			logger.log("Done in " + timer.elapsed(TimeUnit.MILLISECONDS) + "ms. Sentences changed per stage:");
			Util.print(pipeline.getChangedSentences(), Pipeline.STAGE_NAMES.size());
			faults.print(System.err, commandLineOptions.getVerbose());

		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
			System.err.println(CliFactory.createCli(CommandLineArguments.class).getHelpMessage());
		}
	}

	/**
	 * The command line value if one was given, else the property, else the default. A property left blank counts as
	 * not given.
	 */
	static String setting(final String commandLineValue, final Properties properties, final String key,
			final String defaultValue) {
		if (!commandLineValue.isEmpty()) {
			return commandLineValue;
		}
		final String property = properties.getProperty(key);
		final String value = Strings.emptyToNull(property == null ? null : property.trim());
		return value == null ? defaultValue : value;
	}
}

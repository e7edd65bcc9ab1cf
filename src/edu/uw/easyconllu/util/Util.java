package edu.uw.easyconllu.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Serializable;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.Iterator;
import java.util.Properties;
import java.util.zip.GZIPInputStream;

import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;

public class Util {

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	private final static DecimalFormat twoDP = new DecimalFormat("#.00");

	public static String twoDP(final double number) {
		return twoDP.format(number);
	}

	public static String percentage(final int count, final int size) {
		return Util.twoDP((100.0 * count / size)) + "%";
	}

	/**
	 * Reads a UTF-8 file lazily. Files ending in ".gz" are decompressed.
	 */
	public static Iterator<String> readFileLineByLine(final File filePath) throws IOException {
		InputStream stream = new FileInputStream(filePath);
		if (filePath.getName().endsWith(".gz")) {
			stream = new GZIPInputStream(stream);
		}
		return readLines(stream);
	}

	public static Iterator<String> readLines(final InputStream stream) throws IOException {
		final BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
		return new Iterator<String>() {

			String next = br.readLine();

			@Override
			public boolean hasNext() {

				final boolean result = (next != null);
				if (!result) {
					try {
						br.close();
					} catch (final IOException e) {
						throw new RuntimeException(e);
					}
				}

				return result;
			}

			@Override
			public String next() {
				final String result = next;
				try {
					next = br.readLine();
				} catch (final IOException e) {
					throw new RuntimeException(e);
				}
				return result;
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}

	public static Writer openWriter(final File file) throws IOException {
		return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
	}

	public static Properties loadProperties(final File file) {
		try (InputStream in = new FileInputStream(file)) {
			return loadProperties(in);
		} catch (final IOException e) {
			throw new RuntimeException(e);
		}
	}

	/**
	 * Loads properties bundled with the application.
	 */
	public static Properties loadPropertiesFromClasspath(final String resource) {
		try (InputStream in = Util.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalArgumentException("Missing resource: " + resource);
			}
			return loadProperties(in);
		} catch (final IOException e) {
			throw new RuntimeException(e);
		}
	}

	private static Properties loadProperties(final InputStream in) throws IOException {
		final Properties result = new Properties();
		result.load(new InputStreamReader(in, StandardCharsets.UTF_8));
		return result;
	}

	public static <T> void print(final Multiset<T> multiset, final int number) {
		int i = 0;
		for (final T type : Multisets.copyHighestCountFirst(multiset).elementSet()) {
			System.err.println(type + ": " + multiset.count(type));
			i++;
			if (i == number) {
				break;
			}
		}
	}

	public static class Logger implements Serializable {
		/**
		 *
		 */
		private static final long serialVersionUID = 1L;
		private final File file;
		private final SimpleDateFormat format = new SimpleDateFormat("HH:mm:ss");

		public Logger(final File file) {
			this.file = file;
		}

		/**
		 * A logger that only writes to stderr.
		 */
		public Logger() {
			this(null);
		}

		public void log(final String message) {
			final String toWrite = format.format(Calendar.getInstance().getTime()) + "\t" + message;
			System.err.println(toWrite);
			if (file == null) {
				return;
			}

			try (PrintWriter out = new PrintWriter(new BufferedWriter(new FileWriter(file, true)))) {
				out.println(toWrite);
			} catch (final IOException e) {
				System.err.println("ERROR WRITING TO LOG FILE: " + file.getAbsolutePath());
			}
		}
	}
}

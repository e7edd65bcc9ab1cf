package edu.uw.easyconllu.main;

import static edu.uw.easyconllu.corpora.SentenceFixtures.lines;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;

import edu.uw.easyconllu.util.Util;

public class EasyCoNLLUTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testRebankFile() throws IOException {
		final File input = folder.newFile("input.conllu");
		Files.asCharSink(input, StandardCharsets.UTF_8).write(lines(
				"# sent_id = 1",
				"# text = Աւա՜ղ",
				"1	Աւա՜ղ	աւաղ	INTJ	_	_	0	root	_	_",
				""));
		final File output = new File(folder.getRoot(), "output.conllu");

		EasyCoNLLU.main(new String[] { "-f", input.getPath(), "-o", output.getPath(), "-s", "exclamation" });

		assertEquals(lines(
				"# sent_id = 1",
				"# text = Աւա՜ղ",
				"1-2	Աւա՜ղ	_	_	_	_	_	_	_	_",
				"1	Աւաղ	աւաղ	INTJ	_	_	0	root	_	_",
				"2	՜	՜	PUNCT	_	_	1	punct	_	_",
				""), Files.asCharSource(output, StandardCharsets.UTF_8).read());
	}

	@Test
	public void testExportLegacyFile() throws IOException {
		final File input = folder.newFile("input.xml");
		Files.asCharSink(input, StandardCharsets.UTF_8).write(lines(
				"<sentence id=\"1\">",
				"<token id=\"7\" form=\"asē\" lemma=\"asem#2\" part-of-speech=\"V-\" relation=\"pred\" citation-part=\"MATT 5.2\" />",
				"</sentence>"));
		final File output = new File(folder.getRoot(), "output.conllu");

		EasyCoNLLU.main(new String[] { "-f", input.getPath(), "-o", output.getPath(), "-i", "proiel",
				"--outputFormat", "conllu" });

		assertEquals(lines(
				"# sent_id = MATT_5.2",
				"# cite = MATT 5.2",
				"# text = asē",
				"1	asē	asem	V-	_	_	_	pred	_	LId=asem-2",
				""), Files.asCharSource(output, StandardCharsets.UTF_8).read());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testConllCannotBecomeLegacy() throws IOException {
		final File input = folder.newFile("input.conllu");
		EasyCoNLLU.main(new String[] { "-f", input.getPath(), "--outputFormat", "proiel" });
	}

	@Test
	public void testSetting() {
		final Properties properties = new Properties();
		properties.setProperty("stages", " exclamation ");

		assertEquals("multiple-roots", EasyCoNLLU.setting("multiple-roots", properties, "stages", ""));
		assertEquals("exclamation", EasyCoNLLU.setting("", properties, "stages", ""));
		assertEquals("conllu", EasyCoNLLU.setting("", properties, "inputFormat", "conllu"));
	}

	@Test
	public void testBlankPropertyFallsBackToDefault() {
		final Properties properties = new Properties();
		properties.setProperty("outputFormat", "");
		properties.setProperty("logFile", "  ");

		assertEquals("CONLLU", EasyCoNLLU.setting("", properties, "outputFormat", "CONLLU"));
		assertEquals("", EasyCoNLLU.setting("", properties, "logFile", ""));
		assertEquals("proiel", EasyCoNLLU.setting("proiel", properties, "outputFormat", "CONLLU"));
	}

	@Test
	public void testDefaultPropertiesLeaveTheOutputFormatToTheInput() throws IOException {
		final Properties properties = Util.loadPropertiesFromClasspath(EasyCoNLLU.DEFAULT_PROPERTIES);
		assertEquals("PROIEL", EasyCoNLLU.setting("", properties, "outputFormat", "PROIEL"));
	}
}

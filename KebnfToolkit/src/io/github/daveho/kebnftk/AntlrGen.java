// KebnfToolkit - Convert KEBNF grammars to ANTLR 4 grammars
// Copyright (C) 2013,2017,2026 David H. Hovemeyer <david.hovemeyer@gmail.com>
//
// Permission is hereby granted, free of charge, to any person obtaining
// a copy of this software and associated documentation files (the
// "Software"), to deal in the Software without restriction, including
// without limitation the rights to use, copy, modify, merge, publish,
// distribute, sublicense, and/or sell copies of the Software, and to
// permit persons to whom the Software is furnished to do so, subject to
// the following conditions:
// 
// The above copyright notice and this permission notice shall be included
// in all copies or substantial portions of the Software.
// 
// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
// EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
// MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
// IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY
// CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT,
// TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
// SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.

package io.github.daveho.kebnftk;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR 4 grammar generator: converts KEBNF files to a lexer grammar
 * file and a parser grammar file.
 */
public class AntlrGen {
	private static final String USAGE =
			"Usage: java -jar kebnftk.jar antlrgen [options] <output dir> <source.kebnf>...\n" +
			"Options:\n" +
			"  --name <name>     grammar name prefix (default: Grammar)\n" +
			"  --root <rule>     root rule (default: first syntactic rule)\n" +
			"  --strict          fail if a patch does not match\n" +
			"  --lexical <file>  KEBNF file whose rules replace same-named rules\n";

	private final GrammarOptions options;
	private final List<String> lexicalFiles;

	public AntlrGen() {
		this.options = new GrammarOptions();
		this.lexicalFiles = new ArrayList<String>();
	}

	/**
	 * Run the generator.
	 * 
	 * @param args command line arguments
	 * @return exit status: 0 on success, 1 on failure
	 * @throws IOException if a file can't be read or written
	 */
	public int execute(String[] args) throws IOException {
		List<String> positional = new ArrayList<String>();
		for (int i = 0; i < args.length; ++i) {
			String arg = args[i];
			if (arg.equals("--strict")) {
				options.setStrict(true);
			} else if (arg.equals("--name") || arg.equals("--root") || arg.equals("--lexical")) {
				if (i + 1 >= args.length)
					return usage();
				String value = args[++i];
				if (arg.equals("--name"))
					options.setGrammarName(value);
				else if (arg.equals("--root"))
					options.setRootRule(value);
				else
					lexicalFiles.add(value);
			} else if (arg.startsWith("--")) {
				return usage();
			} else {
				positional.add(arg);
			}
		}
		if (positional.size() < 2)
			return usage();

		Path outputDir = Paths.get(positional.get(0));
		List<GrammarSource> sources = new ArrayList<GrammarSource>();
		for (String file : positional.subList(1, positional.size()))
			sources.add(readSource(file, false));
		for (String file : lexicalFiles)
			sources.add(readSource(file, true));

		TranspileResult result = new TranspileGrammar(options).execute(sources);
		for (Diagnostic d : result.getDiagnostics())
			System.err.println(d);
		if (!result.isSuccess())
			return result.getStatus();

		Files.createDirectories(outputDir);
		Path lexerFile = outputDir.resolve(options.getLexerGrammarName() + ".g4");
		Path parserFile = outputDir.resolve(options.getParserGrammarName() + ".g4");
		Files.write(lexerFile, result.getLexerGrammar().getBytes(StandardCharsets.UTF_8));
		Files.write(parserFile, result.getParserGrammar().getBytes(StandardCharsets.UTF_8));

		System.out.printf("Wrote %s and %s (%d warnings)%n", lexerFile, parserFile, result.getDiagnostics().size());
		return 0;
	}

	private int usage() {
		System.err.print(USAGE);
		return 1;
	}

	/**
	 * Read a KEBNF file (UTF-8).
	 * 
	 * @param file     the file name
	 * @param override true if the file's rules replace same-named rules
	 * @return the source
	 * @throws IOException if the file can't be read
	 */
	static GrammarSource readSource(String file, boolean override) throws IOException {
		Path path = Paths.get(file);
		String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		return new GrammarSource(path.getFileName().toString(), text, override);
	}

	public static void main(String[] args) throws Exception {
		AntlrGen antlrGen = new AntlrGen();
		System.exit(antlrGen.execute(args));
	}
}

// This file is part of the PDDL Front-End (pfe).
//
// The PDDL Front-End is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The PDDL Front-End is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the PDDL Front-End. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package pddlfront.io;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

import pddlfront.core.ExpressionManager;
import pddlfront.core.Model;
import pddlfront.core.ModelBuilder;
import pddlfront.core.Syntax;
import pddlfront.core.Types;

/**
 * Reads PDDL domains and problems into planning models. For example:
 *
 * <pre>
 * Model.Problem p = new PddlReader().parseProblem("depot.pddl", "p01.pddl");
 * </pre>
 *
 * A reader constructed without arguments uses fresh type and expression
 * managers for each call, hence it can be shared between threads. Otherwise,
 * the given manager is used for every call and, since it is not synchronised,
 * the reader should only be used by one thread at a time.
 *
 * @author David J. Pearce
 *
 */
public class PddlReader {
	private final ExpressionManager em;

	public PddlReader() {
		this.em = null;
	}

	/**
	 * Construct a reader which builds every model with a given expression
	 * manager (and hence its type manager).
	 *
	 * @param em
	 */
	public PddlReader(ExpressionManager em) {
		this.em = em;
	}

	/**
	 * Parse a domain file on its own.
	 *
	 * @param domainFile
	 * @return
	 * @throws IOException
	 */
	public Model.Problem parseProblem(String domainFile) throws IOException {
		return parse(new Lexer(domainFile), null);
	}

	/**
	 * Parse a domain file together with a problem file.
	 *
	 * @param domainFile
	 * @param problemFile
	 * @return
	 * @throws IOException
	 */
	public Model.Problem parseProblem(String domainFile, String problemFile) throws IOException {
		return parse(new Lexer(domainFile), new Lexer(problemFile));
	}

	/**
	 * Parse the text of a domain on its own.
	 *
	 * @param domain
	 * @return
	 */
	public Model.Problem parseProblemString(String domain) {
		return parse(lexer(domain), null);
	}

	/**
	 * Parse the text of a domain together with the text of a problem.
	 *
	 * @param domain
	 * @param problem
	 * @return
	 */
	public Model.Problem parseProblemString(String domain, String problem) {
		return parse(lexer(domain), lexer(problem));
	}

	private Model.Problem parse(Lexer domainLexer, Lexer problemLexer) {
		ExpressionManager xm = em != null ? em : new ExpressionManager(new Types.Manager());
		String domainText = domainLexer.source();
		Syntax.Domain domain = new Parser(domainText, domainLexer.scan()).parseDomain();
		ModelBuilder builder = new ModelBuilder(xm);
		if (problemLexer == null) {
			return builder.build(domainText, domain);
		}
		String problemText = problemLexer.source();
		Syntax.Problem problem = new Parser(problemText, problemLexer.scan()).parseProblem();
		return builder.build(domainText, domain, problemText, problem);
	}

	private static Lexer lexer(String text) {
		try {
			return new Lexer(new StringReader(text));
		} catch (IOException e) {
			// reading from a string cannot fail
			throw new UncheckedIOException(e);
		}
	}
}

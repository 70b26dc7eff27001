package org.lokray.kernelc.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.util.Debug;
import org.lokray.kernelc.util.ErrorReporter;

/**
 * Routes ANTLR syntax errors through the {@link ErrorReporter}. The first error stops the parse.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final ErrorReporter errorReporter;

	public SyntaxErrorListener(ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		Debug.logDebug(String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg));
		throw errorReporter.error(SourcePosition.of(line, charPositionInLine), "Invalid syntax: " + msg);
	}
}

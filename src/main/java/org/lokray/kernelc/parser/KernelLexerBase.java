package org.lokray.kernelc.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;

/**
 * Base class of the generated {@code KernelLexer}. Turns leading whitespace into
 * {@code INDENT}/{@code DEDENT} tokens and drops line breaks inside brackets.
 */
public abstract class KernelLexerBase extends Lexer
{
	private final LinkedList<Token> pending = new LinkedList<>();
	private final Deque<Integer> indents = new ArrayDeque<>();
	private int opened = 0;
	private Token lastToken = null;

	protected KernelLexerBase(CharStream input)
	{
		super(input);
	}

	@Override
	public void emit(Token token)
	{
		super.setToken(token);
		pending.offer(token);
	}

	@Override
	public Token nextToken()
	{
		if (_input.LA(1) == EOF && !indents.isEmpty())
		{
			// Drop queued EOF tokens, close the open blocks, then re-emit EOF
			for (int i = pending.size() - 1; i >= 0; i--)
			{
				if (pending.get(i).getType() == EOF)
				{
					pending.remove(i);
				}
			}
			emit(commonToken(KernelLexer.NEWLINE, "\n"));
			while (!indents.isEmpty())
			{
				emit(createDedent());
				indents.pop();
			}
			emit(commonToken(EOF, "<EOF>"));
		}

		Token next = super.nextToken();
		if (next.getChannel() == Token.DEFAULT_CHANNEL)
		{
			lastToken = next;
		}
		return pending.isEmpty() ? next : pending.poll();
	}

	@Override
	public void reset()
	{
		pending.clear();
		indents.clear();
		opened = 0;
		lastToken = null;
		super.reset();
	}

	protected boolean atStartOfInput()
	{
		return getCharPositionInLine() == 0 && getLine() == 1;
	}

	protected void openBrace()
	{
		opened++;
	}

	protected void closeBrace()
	{
		opened--;
	}

	protected void onNewLine()
	{
		String newLine = getText().replaceAll("[^\r\n\f]+", "");
		String spaces = getText().replaceAll("[\r\n\f]+", "");

		int next = _input.LA(1);
		int nextNext = _input.LA(2);
		boolean blankOrCommentLine = nextNext != EOF && (next == '\r' || next == '\n' || next == '\f' || next == '#');

		if (opened > 0 || blankOrCommentLine)
		{
			skip();
			return;
		}

		CommonToken lineBreak = commonToken(KernelLexer.NEWLINE, newLine);
		// The break comes before the indentation matched with it
		lineBreak.setStartIndex(_tokenStartCharIndex);
		lineBreak.setStopIndex(_tokenStartCharIndex + newLine.length() - 1);
		emit(lineBreak);
		int indent = getIndentationCount(spaces);
		int previous = indents.isEmpty() ? 0 : indents.peek();
		if (indent == previous)
		{
			skip();
		}
		else if (indent > previous)
		{
			indents.push(indent);
			emit(commonToken(KernelLexer.INDENT, spaces));
		}
		else
		{
			while (!indents.isEmpty() && indents.peek() > indent)
			{
				emit(createDedent());
				indents.pop();
			}
		}
	}

	private Token createDedent()
	{
		CommonToken dedent = commonToken(KernelLexer.DEDENT, "");
		if (lastToken != null)
		{
			dedent.setLine(lastToken.getLine());
		}
		return dedent;
	}

	private CommonToken commonToken(int type, String text)
	{
		int stop = getCharIndex() - 1;
		int start = text.isEmpty() ? stop : stop - text.length() + 1;
		CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
		// Positioned at the line break, not at the line that follows it
		token.setLine(_tokenStartLine);
		token.setCharPositionInLine(_tokenStartCharPositionInLine);
		return token;
	}

	// Tabs advance to the next multiple of eight
	private static int getIndentationCount(String spaces)
	{
		int count = 0;
		for (char ch : spaces.toCharArray())
		{
			if (ch == '\t')
			{
				count += 8 - (count % 8);
			}
			else
			{
				count++;
			}
		}
		return count;
	}
}

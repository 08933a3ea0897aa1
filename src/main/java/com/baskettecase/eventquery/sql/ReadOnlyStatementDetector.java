package com.baskettecase.eventquery.sql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a statement may be served by a read replica.
 *
 * Uses JSQLParser to recognise SELECT statements. PostgreSQL syntax the parser does not
 * understand falls back to the leading keyword.
 *
 * @see <a href="https://github.com/JSQLParser/JSqlParser">JSQLParser Documentation</a>
 */
@Slf4j
@Component
public class ReadOnlyStatementDetector {

    private static final Pattern LEADING_COMMENTS = Pattern.compile("^(\\s*(--[^\\n]*\\n|/\\*.*?\\*/))*\\s*", Pattern.DOTALL);
    private static final Pattern DML_IN_CTE = Pattern.compile("\\(\\s*(insert|update|delete)\\s");
    private static final Pattern LOCKING_CLAUSE =
            Pattern.compile("\\bfor\\s+(update|share|no\\s+key\\s+update|key\\s+share)\\b");

    public boolean isReadOnly(String sql) {
        if (sql == null || sql.isBlank()) {
            return false;
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            if (!(statement instanceof Select)) {
                return false;
            }
            if (statement instanceof PlainSelect && ((PlainSelect) statement).getForMode() != null) {
                return false;
            }
            return !hasLockingClause(sql);
        } catch (JSQLParserException e) {
            log.debug("Statement not parseable, classifying by keyword: {}", e.getMessage());
            return startsWithReadKeyword(sql);
        }
    }

    private boolean startsWithReadKeyword(String sql) {
        String body = LEADING_COMMENTS.matcher(sql).replaceFirst("").toLowerCase(Locale.ROOT);
        return (body.startsWith("select") || body.startsWith("with")) && !hasLockingClause(sql);
    }

    // "with ... insert/update/delete" and row locks in nested selects need the primary
    private boolean hasLockingClause(String sql) {
        String lower = sql.toLowerCase(Locale.ROOT);
        return LOCKING_CLAUSE.matcher(lower).find()
                || DML_IN_CTE.matcher(lower).find();
    }
}

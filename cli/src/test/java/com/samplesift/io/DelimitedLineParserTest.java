package com.samplesift.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

final class DelimitedLineParserTest {

    @Test
    void sniffsTabsBeforeCommas() {
        assertEquals('\t', DelimitedLineParser.sniffDelimiter("strain\tdate\tnote,with,commas"));
        assertEquals(',', DelimitedLineParser.sniffDelimiter("strain,date,country"));
        assertEquals(',', DelimitedLineParser.sniffDelimiter("strain,\"a\tb\""));
        assertEquals('\t', DelimitedLineParser.sniffDelimiter("strain"));
    }

    @Test
    void honorsQuotedCellsAndEscapedQuotes() {
        assertEquals(
                List.of("A", "Lima, Peru", "say \"hi\"", ""),
                DelimitedLineParser.parse("A,\"Lima, Peru\",\"say \"\"hi\"\"\",", ','));
    }

    @Test
    void quotesOnlyWhenNeeded() {
        assertEquals("plain", DelimitedLineParser.quote("plain", '\t'));
        assertEquals("\"a\tb\"", DelimitedLineParser.quote("a\tb", '\t'));
        assertEquals("\"x \"\"y\"\"\"", DelimitedLineParser.quote("x \"y\"", '\t'));
    }
}

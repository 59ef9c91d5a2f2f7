package tools.sqlscope.parser;

import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * 整个缓冲区的解析结果。chunks 与 tempTables 中的下标都指向 tokens（已去掉注释）。
 * rawTokens 保留注释，用于判断光标是否落在字符串或注释中。
 */
public record ParseResult(List<Chunk> chunks,
                          List<TempTable> tempTables,
                          List<Token> tokens,
                          List<Token> rawTokens) {

    public ParseResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        tempTables = tempTables == null ? List.of() : List.copyOf(tempTables);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        rawTokens = rawTokens == null ? tokens : List.copyOf(rawTokens);
    }

    /**
     * 包含光标的顶层语句，没有则返回 null。
     */
    public Chunk chunkAt(int cursorIndex) {
        for (Chunk chunk : chunks) {
            if (chunk.contains(cursorIndex)) {
                return chunk;
            }
        }
        return null;
    }

    /**
     * 光标之前出现过的批次分隔符数量。
     */
    public int batchIndexAt(int cursorIndex) {
        int batch = 0;
        int limit = Math.min(cursorIndex, tokens.size());
        for (int i = 0; i < limit; i++) {
            if (tokens.get(i).is(TokenType.GO)) {
                batch++;
            }
        }
        return batch;
    }

    public List<TempTable> tempTablesVisibleAt(int cursorIndex) {
        int batch = batchIndexAt(cursorIndex);
        List<TempTable> visible = new ArrayList<>();
        for (TempTable t : tempTables) {
            if (t.isVisibleAt(batch, cursorIndex)) {
                visible.add(t);
            }
        }
        return visible;
    }
}

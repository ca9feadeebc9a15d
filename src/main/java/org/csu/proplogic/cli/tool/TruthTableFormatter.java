package org.csu.proplogic.cli.tool;

import org.csu.proplogic.engine.TruthTable;
import org.csu.proplogic.engine.TruthTableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 将真值表格式化为带边框的控制台表格，取值显示为 1/0，最后一列为 RESULT。
 */
public class TruthTableFormatter {

    public static final String RESULT_HEADER = "RESULT";

    /**
     * @param table 真值表
     * @return 格式化后的表格字符串
     */
    public static String format(TruthTable table) {
        if (table.rows().isEmpty()) {
            return "Truth table is empty, 0 rows returned.";
        }

        StringBuilder sb = new StringBuilder();
        List<String> headers = new ArrayList<>(table.variables());
        headers.add(RESULT_HEADER);
        // 单元格只有 1 位，列宽由表头决定
        List<Integer> columnWidths = headers.stream().map(String::length).toList();

        sb.append(border(columnWidths)).append("\n");
        sb.append(line(headers, columnWidths)).append("\n");
        sb.append(border(columnWidths)).append("\n");

        for (TruthTableRow row : table.rows()) {
            List<String> cells = new ArrayList<>();
            for (Boolean value : row.values()) {
                cells.add(value ? "1" : "0");
            }
            cells.add(String.valueOf(row.resultBit()));
            sb.append(line(cells, columnWidths)).append("\n");
        }

        sb.append(border(columnWidths)).append("\n");
        sb.append(table.size()).append(" rows, ").append(table.variables().size()).append(" variables.");
        return sb.toString();
    }

    // 单元格左对齐，两侧各留一个空格
    private static String line(List<String> cells, List<Integer> widths) {
        return IntStream.range(0, cells.size())
                .mapToObj(i -> " " + cells.get(i) + " ".repeat(widths.get(i) - cells.get(i).length() + 1))
                .collect(Collectors.joining("|", "|", "|"));
    }

    private static String border(List<Integer> widths) {
        return widths.stream()
                .map(width -> "-".repeat(width + 2))
                .collect(Collectors.joining("+", "+", "+"));
    }
}

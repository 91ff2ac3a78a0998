package feols.formula;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DataTableTest {

    @Test
    void groupCodes_followFirstAppearanceAndMarkMissing() {
        DataTable table = new DataTable()
                .addCategorical("state", new String[] {"ny", "ca", "ny", null, "tx"})
                .addNumeric("year", new double[] {2001, 2000, 2001, 2000, Double.NaN});

        assertThat(table.groupCodes("state")).containsExactly(0, 1, 0, -1, 2);
        assertThat(table.groupCodes("year")).containsExactly(0, 1, 0, 1, -1);
    }

    @Test
    void groupCodes_treatNegativeZeroAsZero() {
        DataTable table = new DataTable().addNumeric("g", new double[] {0.0, -0.0, 1, -0.0});

        assertThat(table.groupCodes("g")).containsExactly(0, 0, 1, 0);
    }

    @Test
    void dropRows_removesTheSameRowsFromEveryColumn() {
        DataTable table = new DataTable()
                .addNumeric("x", new double[] {1, 2, 3, 4})
                .addCategorical("g", new String[] {"a", "b", "c", "d"});

        DataTable kept = table.dropRows(new int[] {1, 3});

        assertThat(kept.rowCount()).isEqualTo(2);
        assertThat(kept.numeric("x")).containsExactly(1, 3);
        assertThat(kept.groupCodes("g")).containsExactly(0, 1);
        assertThat(table.rowCount()).isEqualTo(4);
    }

    @Test
    void addNumeric_rejectsLengthMismatch() {
        DataTable table = new DataTable().addNumeric("x", new double[] {1, 2, 3});

        assertThatThrownBy(() -> table.addNumeric("y", new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has 2 rows, table has 3");
    }

    @Test
    void addNumeric_rejectsDuplicateColumn() {
        DataTable table = new DataTable().addNumeric("x", new double[] {1});

        assertThatThrownBy(() -> table.addCategorical("x", new String[] {"a"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate column");
    }

    @Test
    void numeric_returnsACopy() {
        DataTable table = new DataTable().addNumeric("x", new double[] {1, 2});

        table.numeric("x")[0] = 99;

        assertThat(table.numeric("x")).containsExactly(1, 2);
    }

    @Test
    void unknownColumns_areRejected() {
        DataTable table = new DataTable().addNumeric("x", new double[] {1});

        assertThatThrownBy(() -> table.numeric("y")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> table.groupCodes("y")).isInstanceOf(IllegalArgumentException.class);
    }
}

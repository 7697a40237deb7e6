package io.github.yok.sqlinsert.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sqlinsert.fixture.Candy;
import io.github.yok.sqlinsert.fixture.CandyRecord;
import java.lang.ref.WeakReference;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnnotatedRecordsTest {

    /**
     * Bean with an untagged field and a static constant.
     */
    static class PartiallyTagged {
        static final String IGNORED = "static";

        @ColumnTag("a")
        private final int first = 1;

        private final String untagged = "u";

        @ColumnTag(key = "db", value = "C")
        private final String third = null;
    }

    @BeforeEach
    void setUp() {
        AnnotatedRecords.clearCache(Candy.class);
        AnnotatedRecords.clearCache(PartiallyTagged.class);
    }

    @Test
    void of_正常ケース_タグ付きBeanを指定する_宣言順のフィールドが返ること() {
        List<RecordField> fields = AnnotatedRecords.of(Candy.gougat()).fields();

        assertEquals(Arrays.asList("id", "candy_name", "form_factor", "description",
                "manufacturer", "weight_grams", "ts"),
                fields.stream().map(RecordField::getName).collect(Collectors.toList()));
        assertEquals(7, fields.get(6).getPosition());
        assertEquals("Gougat", fields.get(1).getValue());
        assertEquals(1.1618, fields.get(5).getValue());
        assertEquals(Candy.EPOCH, fields.get(6).getValue());
    }

    @Test
    void of_正常ケース_InsertRecord実装と同じデータを指定する_同一のフィールドが返ること() {
        assertEquals(CandyRecord.gougat().fields(), AnnotatedRecords.of(Candy.gougat()).fields());
    }

    @Test
    void of_正常ケース_タグのないフィールドを含む_空の名前で描画されること() {
        List<RecordField> fields = AnnotatedRecords.of(new PartiallyTagged()).fields();

        assertEquals(3, fields.size());
        assertEquals(new RecordField("a", 1, 1), fields.get(0));
        assertEquals(new RecordField("", 2, "u"), fields.get(1));
        assertEquals(new RecordField("", 3, null), fields.get(2));
    }

    @Test
    void of_正常ケース_別のキーを指定する_キーに一致するタグの名前が返ること() {
        List<RecordField> legacy = AnnotatedRecords.of(Candy.gougat(), "legacy").fields();
        assertEquals("", legacy.get(0).getName());
        assertEquals("NAME", legacy.get(1).getName());

        List<RecordField> db = AnnotatedRecords.of(new PartiallyTagged(), "db").fields();
        assertEquals("", db.get(0).getName());
        assertEquals("C", db.get(2).getName());
    }

    @Test
    void of_正常ケース_同じクラスを複数回変換する_形状が一度だけ導出されること() {
        AnnotatedRecords.of(Candy.gougat());
        AnnotatedRecords.of(Candy.withId("c2"));
        assertEquals(1, AnnotatedRecords.cachedShapeCount(Candy.class));

        AnnotatedRecords.of(Candy.gougat(), "legacy");
        assertEquals(2, AnnotatedRecords.cachedShapeCount(Candy.class));
    }

    @Test
    void of_正常ケース_変換後にBeanを変更する_レコードは変換時の値を保持すること() {
        Candy candy = Candy.gougat();
        InsertRecord record = AnnotatedRecords.of(candy);
        candy.setName("Changed");

        assertEquals("Gougat", record.fields().get(1).getValue());
    }

    @Test
    void listOf_正常ケース_単体と配列とリストを指定する_同一のレコード内容が返ること() {
        Candy candy = Candy.gougat();
        List<InsertRecord> single = AnnotatedRecords.listOf(candy, ColumnTag.DEFAULT_KEY);
        List<InsertRecord> array =
                AnnotatedRecords.listOf(new Candy[] {candy}, ColumnTag.DEFAULT_KEY);
        List<InsertRecord> iterable = AnnotatedRecords.listOf(
                new LinkedHashSet<>(List.of(candy)), ColumnTag.DEFAULT_KEY);

        assertEquals(1, single.size());
        assertEquals(single.get(0).fields(), array.get(0).fields());
        assertEquals(single.get(0).fields(), iterable.get(0).fields());
    }

    @Test
    void listOf_正常ケース_InsertRecordを含むバッチを指定する_そのまま使われること() {
        CandyRecord record = CandyRecord.gougat();
        List<InsertRecord> records =
                AnnotatedRecords.listOf(List.of(record, Candy.withId("c2")), "col");

        assertSame(record, records.get(0));
        assertEquals("c2", records.get(1).fields().get(0).getValue());
        assertSame(record, AnnotatedRecords.listOf(record, "col").get(0));
    }

    @Test
    void listOf_境界ケース_空のリストを指定する_空リストが返ること() {
        assertEquals(0, AnnotatedRecords.listOf(List.of(), "col").size());
    }

    @Test
    void listOf_異常ケース_Bean以外を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> AnnotatedRecords.listOf(42, "col"));
        assertThrows(IllegalArgumentException.class,
                () -> AnnotatedRecords.listOf(List.of("text"), "col"));
    }

    @Test
    void listOf_異常ケース_null要素を含む_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class,
                () -> AnnotatedRecords.listOf(new Candy[] {Candy.gougat(), null}, "col"));
        assertThrows(NullPointerException.class, () -> AnnotatedRecords.listOf(null, "col"));
    }

    @Test
    void of_異常ケース_バッチを指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> AnnotatedRecords.of(List.of(Candy.gougat())));
    }

    @Test
    void of_正常ケース_別のクラスローダーの同名クラスを変換する_クラスごとに形状が保持され解放されること()
            throws Exception {
        URL[] urls = {Candy.class.getProtectionDomain().getCodeSource().getLocation(),
                ColumnTag.class.getProtectionDomain().getCodeSource().getLocation()};
        URLClassLoader loader = new URLClassLoader(urls, null);
        Class<?> isolated = loader.loadClass(Candy.class.getName());
        WeakReference<ClassLoader> loaderRef = new WeakReference<>(loader);

        List<RecordField> fields =
                AnnotatedRecords.of(isolated.getDeclaredConstructor().newInstance()).fields();
        AnnotatedRecords.of(Candy.gougat());

        // the isolated class carries its own ColumnTag type, so no tag matches
        assertEquals(7, fields.size());
        assertTrue(fields.stream().allMatch(field -> field.getName().isEmpty()));
        assertEquals(1, AnnotatedRecords.cachedShapeCount(isolated));
        assertEquals(1, AnnotatedRecords.cachedShapeCount(Candy.class));
        assertEquals("candy_name", AnnotatedRecords.of(Candy.gougat()).fields().get(1).getName());

        isolated = null;
        fields = null;
        loader.close();
        loader = null;
        for (int i = 0; i < 20 && loaderRef.get() != null; i++) {
            System.gc();
            Thread.sleep(50);
        }
        assertNull(loaderRef.get());
    }
}

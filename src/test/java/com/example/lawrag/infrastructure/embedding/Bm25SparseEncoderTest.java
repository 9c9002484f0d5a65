package com.example.lawrag.infrastructure.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.lawrag.domain.model.SparseVector;
import java.util.List;
import org.junit.jupiter.api.Test;

class Bm25SparseEncoderTest {

    private final Bm25SparseEncoder encoder = new Bm25SparseEncoder(1.2, 0.75, 256);

    private static float weightOf(SparseVector v, String token) {
        int index = Bm25SparseEncoder.indexOf(token);
        for (int i = 0; i < v.indices().length; i++) {
            if (v.indices()[i] == index) {
                return v.values()[i];
            }
        }
        return 0f;
    }

    @Test
    void tokenizationFoldsOrthographyAndDigits() {
        assertEquals(List.of("الاحكام", "المحكمه", "318"), encoder.tokenize("الأحكام في المحكمة ٣١٨"));
        assertEquals(List.of("penal", "code"), encoder.tokenize("The Penal CODE"));
    }

    @Test
    void repeatedTermsWeighMoreButSaturate() {
        SparseVector v = encoder.encode("عقوبة عقوبة عقوبة الحبس");

        float repeated = weightOf(v, "عقوبه");
        float single = weightOf(v, "الحبس");
        assertTrue(repeated > single);
        assertTrue(repeated < 3 * single);
        assertEquals(2, v.nonZeroCount());
    }

    @Test
    void queryWeightsAreOnePerDistinctTerm() {
        SparseVector q = encoder.encodeQuery("عقوبة السرقة عقوبة");

        assertEquals(2, q.nonZeroCount());
        assertArrayEquals(new float[]{1f, 1f}, q.values());
    }

    @Test
    void sameTermMapsToSameDimensionAcrossSpellings() {
        SparseVector doc = encoder.encode("إجراءات");
        SparseVector query = encoder.encodeQuery("اجراءات");

        assertArrayEquals(doc.indices(), query.indices());
    }

    @Test
    void indicesAreSortedAndNonNegative() {
        SparseVector v = encoder.encode("يعاقب بالحبس كل من ارتكب جريمة السرقة في الطريق العام ليلا");

        for (int i = 0; i < v.indices().length; i++) {
            assertTrue(v.indices()[i] >= 0);
            if (i > 0) {
                assertTrue(v.indices()[i] > v.indices()[i - 1]);
            }
            assertTrue(v.values()[i] > 0f);
        }
    }

    @Test
    void blankOrStopWordOnlyTextIsEmpty() {
        assertTrue(encoder.encode("").isEmpty());
        assertTrue(encoder.encode("في من على").isEmpty());
        assertTrue(encoder.encodeQuery(null).isEmpty());
        assertEquals(2, encoder.encodeBatch(List.of("نص", "")).size());
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new Bm25SparseEncoder(0, 0.75, 256));
        assertThrows(IllegalArgumentException.class, () -> new Bm25SparseEncoder(1.2, 1.5, 256));
    }
}

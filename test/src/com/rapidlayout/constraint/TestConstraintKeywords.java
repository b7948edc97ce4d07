package com.rapidlayout.constraint;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestConstraintKeywords {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "xcenter|sx1+sx2>=ox1+ox2-2, sx1+sx2<=ox1+ox2+2",
        "left|sx1=ox1",
        "swidth=10|(sx2-sx1)=10",
        "width=20, height=5|(x2-x1)=20, (y2-y1)=5",
        "ll_edge>=3|(sx1-ox1)>=3",
        "l_edge=2|(ox1-sx1)=2",
        "sx=ox+5|sx1=ox1+5",
        "sx1+3<ox1|sx1+3<ox1",
    })
    public void testExpand(String input, String expected) {
        Assertions.assertEquals(expected, ConstraintKeywords.expand(input));
    }

    @Test
    public void testCenterExpandsBothAxes() {
        Assertions.assertEquals("sx1+sx2>=ox1+ox2-2, sx1+sx2<=ox1+ox2+2, sy1+sy2>=oy1+oy2-2, sy1+sy2<=oy1+oy2+2",
            ConstraintKeywords.expand("center"));
        Assertions.assertEquals(4, RelationParser.parse(ConstraintKeywords.expand("center"), true).size());
    }

    @Test
    public void testCenterRelations() {
        Assertions.assertEquals("sy1+sy2=oy1+oy2", ConstraintKeywords.centerRelations('y', 0));
        Assertions.assertEquals("sx1+sx2>=ox1+ox2-6, sx1+sx2<=ox1+ox2+6", ConstraintKeywords.centerRelations('x', 3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConstraintKeywords.centerRelations('x', -1));
    }

    @Test
    public void testScaledSizeKeepsMeaning() {
        String expanded = ConstraintKeywords.expand("2*swidth=owidth");
        Relation relation = RelationParser.parseRelation(expanded, true);
        Assertions.assertEquals(2, relation.getCoefficients().get(CoordinateRef.subject(Corner.X2)));
        Assertions.assertEquals(-2, relation.getCoefficients().get(CoordinateRef.subject(Corner.X1)));
        Assertions.assertEquals(-1, relation.getCoefficients().get(CoordinateRef.object(Corner.X2)));
        Assertions.assertEquals(1, relation.getCoefficients().get(CoordinateRef.object(Corner.X1)));
    }

    @Test
    public void testKeywordLookup() {
        Assertions.assertTrue(ConstraintKeywords.isKeyword("tt_edge"));
        Assertions.assertFalse(ConstraintKeywords.isKeyword("sx1"));
    }
}

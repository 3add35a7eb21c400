package com.example.shortvideo_backend.ffmpeg;

import com.example.shortvideo_backend.util.CaptionPosition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssStyleUtilTest {

    @Test
    void toAssColorConvertsHexWhite() {
        assertThat(AssStyleUtil.toAssColor("#FFFFFF")).isEqualTo("&H00FFFFFF");
    }

    @Test
    void toAssColorSwapsChannelOrder() {
        assertThat(AssStyleUtil.toAssColor("#102030")).isEqualTo("&H00302010");
        assertThat(AssStyleUtil.toAssColor("#f00")).isEqualTo("&H000000FF");
    }

    @Test
    void toAssColorConvertsRgbaWithAlpha() {
        assertThat(AssStyleUtil.toAssColor("rgba(0,0,0,0.5)")).isEqualTo("&H7F000000");
        assertThat(AssStyleUtil.toAssColor("rgb(255, 0, 0)")).isEqualTo("&H000000FF");
    }

    @Test
    void toAssColorAcceptsKeywordsAndFallsBackToWhite() {
        assertThat(AssStyleUtil.toAssColor("blue")).isEqualTo("&H00FF0000");
        assertThat(AssStyleUtil.toAssColor("Transparent")).isEqualTo("&HFF000000");
        assertThat(AssStyleUtil.toAssColor("not-a-colour")).isEqualTo("&H00FFFFFF");
        assertThat(AssStyleUtil.toAssColor(null)).isEqualTo("&H00FFFFFF");
    }

    @Test
    void styleLineCarriesBoxColourAndAlignment() {
        String style = AssStyleUtil.buildStyleLine("Arial", 70, "blue", CaptionPosition.TOP, 86, 230);

        assertThat(style).startsWith("Style: Default,Arial,70,&H00FFFFFF,&H00FFFFFF,&H00FF0000,&H00FF0000,");
        assertThat(style).endsWith(",3,2,0,8,86,86,230,1");
    }
}

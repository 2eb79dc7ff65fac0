package com.scholary.watermark.compositing;

import static com.scholary.watermark.TestImages.solid;
import static com.scholary.watermark.TestImages.solidRgb;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.watermark.parameter.Opacity;
import java.awt.image.BufferedImage;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class CompositorTest {

  private static final int BASE = 0xFF336699;
  private static final int WHITE = 0xFFFFFFFF;

  @Test
  void resize_shouldScaleToHeightAndTruncateWidth() {
    BufferedImage resized = Compositor.resize(solidRgb(301, 200, BASE), 100);

    assertThat(resized.getHeight()).isEqualTo(100);
    assertThat(resized.getWidth()).isEqualTo(150);
    assertThat(ImageCodec.hasAlpha(resized)).isFalse();
  }

  @Test
  void resize_shouldKeepAtLeastOnePixelOfWidth() {
    BufferedImage resized = Compositor.resize(solid(3, 700, BASE), 2);

    assertThat(resized.getWidth()).isEqualTo(1);
    assertThat(ImageCodec.hasAlpha(resized)).isTrue();
  }

  @Test
  void resize_shouldRejectNonPositiveHeight() {
    assertThatThrownBy(() -> Compositor.resize(solid(4, 4, BASE), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resizeAndReencode_shouldReturnDecodedImageAtTargetHeight() throws IOException {
    BufferedImage result = Compositor.resizeAndReencode(solidRgb(80, 40, BASE), 20, 30);

    assertThat(result.getHeight()).isEqualTo(20);
    assertThat(result.getWidth()).isEqualTo(40);
    assertThat(ImageCodec.hasAlpha(result)).isFalse();
  }

  @Test
  void overlayAndCrop_shouldLeaveBaseUnchangedAtZeroOpacity() {
    BufferedImage base = solid(10, 10, BASE);

    BufferedImage result =
        Compositor.overlayAndCrop(base, solid(10, 10, WHITE), Opacity.TRANSPARENT);

    assertThat(pixels(result)).isEqualTo(pixels(base));
  }

  @Test
  void overlayAndCrop_shouldFollowOverlayAlphaAtFullOpacity() {
    BufferedImage overlay = solid(10, 10, WHITE);
    overlay.setRGB(0, 0, 0x00FFFFFF);

    BufferedImage result = Compositor.overlayAndCrop(solid(10, 10, BASE), overlay, Opacity.OPAQUE);

    assertThat(result.getRGB(0, 0)).isEqualTo(BASE);
    assertThat(result.getRGB(5, 5)).isEqualTo(WHITE);
  }

  @Test
  void overlayAndCrop_shouldBlendByOpacity() {
    BufferedImage result =
        Compositor.overlayAndCrop(solid(4, 4, 0xFF000000), solid(4, 4, WHITE), Opacity.of(0.5));

    int pixel = result.getRGB(1, 1);
    assertThat(Compositor.alpha(pixel)).isEqualTo(255);
    assertThat(Compositor.red(pixel)).isEqualTo(128);
    assertThat(Compositor.green(pixel)).isEqualTo(128);
  }

  @Test
  void overlayAndCrop_shouldCropLargerOverlayToBase() {
    BufferedImage result =
        Compositor.overlayAndCrop(solid(20, 10, BASE), solid(50, 40, WHITE), Opacity.OPAQUE);

    assertThat(result.getWidth()).isEqualTo(20);
    assertThat(result.getHeight()).isEqualTo(10);
    assertThat(result.getRGB(19, 9)).isEqualTo(WHITE);
  }

  @Test
  void overlayAndCrop_shouldKeepPixelsOutsideSmallerOverlay() {
    BufferedImage result =
        Compositor.overlayAndCrop(solid(20, 20, BASE), solid(5, 5, WHITE), Opacity.OPAQUE);

    assertThat(result.getRGB(4, 4)).isEqualTo(WHITE);
    assertThat(result.getRGB(5, 5)).isEqualTo(BASE);
    assertThat(result.getRGB(19, 0)).isEqualTo(BASE);
  }

  @Test
  void overlayAndCrop_shouldNotModifyInputs() {
    BufferedImage base = solid(6, 6, BASE);
    BufferedImage overlay = solid(6, 6, WHITE);

    Compositor.overlayAndCrop(base, overlay, Opacity.OPAQUE);

    assertThat(base.getRGB(2, 2)).isEqualTo(BASE);
    assertThat(overlay.getRGB(2, 2)).isEqualTo(WHITE);
  }

  @Test
  void brighten_shouldNeverLowerLuminance() {
    BufferedImage overlay = new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB);
    for (int y = 0; y < 16; y++) {
      for (int x = 0; x < 16; x++) {
        overlay.setRGB(x, y, 0x80000000 | (x * 16) << 16 | (y * 16) << 8 | (x + y) * 7);
      }
    }

    BufferedImage brightened = Compositor.brighten(overlay, 0.6);

    for (int y = 0; y < 16; y++) {
      for (int x = 0; x < 16; x++) {
        int before = overlay.getRGB(x, y);
        int after = brightened.getRGB(x, y);
        assertThat(Compositor.luminance(after))
            .isGreaterThanOrEqualTo(Compositor.luminance(before));
        assertThat(Compositor.alpha(after)).isEqualTo(Compositor.alpha(before));
      }
    }
  }

  @Test
  void brighten_shouldLeavePixelsAboveTargetAlone() {
    BufferedImage overlay = solid(2, 2, WHITE);

    BufferedImage brightened = Compositor.brighten(overlay, 0.3);

    assertThat(brightened.getRGB(0, 0)).isEqualTo(WHITE);
  }

  @Test
  void targetLuminance_shouldBeCappedAtOne() {
    BufferedImage base = solid(2, 2, 0xFFC0C0C0);

    assertThat(Compositor.targetLuminance(base, 100.0)).isEqualTo(1.0);
    assertThat(Compositor.targetLuminance(base, 1.0))
        .isCloseTo(Compositor.maxLuminance(base), within(1e-12));
  }

  @Test
  void luminance_shouldUseBt709Weights() {
    assertThat(Compositor.luminance(WHITE)).isCloseTo(1.0, within(1e-9));
    assertThat(Compositor.luminance(0xFF00FF00)).isCloseTo(0.7152, within(1e-9));
    assertThat(Compositor.luminance(0xFF000000)).isZero();
  }

  @Test
  void enhanceBrightness_shouldKeepBaseDimensionsAndMaxAlpha() {
    BufferedImage base = solid(10, 8, 0x80404040);
    BufferedImage overlay = solid(30, 30, 0xFF202020);

    BufferedImage result = Compositor.enhanceBrightness(base, overlay, 1.2, Opacity.TRANSPARENT);

    assertThat(result.getWidth()).isEqualTo(10);
    assertThat(result.getHeight()).isEqualTo(8);
    assertThat(Compositor.alpha(result.getRGB(3, 3))).isEqualTo(255);
    assertThat(Compositor.luminance(result.getRGB(3, 3)))
        .isGreaterThan(Compositor.luminance(0xFF202020));
  }

  @Test
  void enhanceBrightness_shouldIgnoreOpacity() {
    BufferedImage base = solid(6, 6, 0xFF808080);
    BufferedImage overlay = solid(6, 6, 0x99303030);

    BufferedImage none = Compositor.enhanceBrightness(base, overlay, 1.0, Opacity.TRANSPARENT);
    BufferedImage full = Compositor.enhanceBrightness(base, overlay, 1.0, Opacity.OPAQUE);

    assertThat(pixels(none)).isEqualTo(pixels(full));
  }

  private static int[] pixels(BufferedImage image) {
    return image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
  }
}

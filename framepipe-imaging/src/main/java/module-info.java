/**
 * FramePipe Imaging Module
 *
 * Frame generation and JPEG persistence used by the pipeline's producer and workers.
 *
 * Implementations:
 * - RandomFrameGenerator: fixed-size frames filled with pseudo-random BGR noise
 * - JpegFramePersister: ImageIO JPEG encoding, one file per frame
 * - DirectoryOutputLocation: wipes and recreates the output directory
 *
 * @since 0.1.0
 */
module com.framepipe.imaging {
    requires transitive com.framepipe.core;
    requires java.desktop;
    requires org.slf4j;

    exports com.framepipe.imaging;
}

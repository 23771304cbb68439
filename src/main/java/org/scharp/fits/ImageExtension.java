///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A data unit that holds an image.
 */
public final class ImageExtension extends Extension {

    private final TypedImage image;

    ImageExtension(TypedImage image) {
        this.image = image;
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.IMAGE;
    }

    /**
     * @return The image. This is not a copy.
     */
    public TypedImage image() {
        return image;
    }

    @Override
    Bitpix bitpix() {
        return image.bitpix();
    }

    @Override
    int[] shape() {
        return image.shape();
    }

    /**
     * {@inheritDoc}
     *
     * @throws UnsupportedMemoryLayoutException
     *     if the image is a discontiguous view.
     */
    @Override
    DataWriter prepareWrite() throws FitsException {
        ImageCodec.checkEncodable(image);
        return (writer, options) -> ImageCodec.encode(image, writer, options);
    }
}

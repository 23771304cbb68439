///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads a header from a stream, one block at a time.
 */
final class HeaderReader {

    private static final Logger log = LoggerFactory.getLogger(HeaderReader.class);

    private static final int LAST_RECORD_OFFSET = FitsReader.BLOCK_SIZE - KeywordRecord.RECORD_SIZE;

    // private constructor to prevent anyone from instantiating the class.
    private HeaderReader() {
    }

    /**
     * Reads the next header.
     * <p>
     * Blocks are read until one ends with an {@code END} or blank record. Records that follow {@code END} within its
     * block are ignored.
     * </p>
     *
     * @param reader
     *     The stream, positioned at the start of a header.
     * @param codecOptions
     *     How strictly to check the header.
     *
     * @return The header.
     *
     * @throws InvalidHeaderException
     *     if the header is malformed.
     * @throws IOException
     *     if the stream ends or fails.
     */
    static Header read(FitsReader reader, CodecOptions codecOptions) throws IOException {
        Metadata metadata = new Metadata();
        HeaderAssembler assembler = new HeaderAssembler(metadata, codecOptions.strictness());

        int blockCount = 0;
        int recordNumber = 0;
        boolean lastBlock;
        do {
            byte[] block = reader.readBlocks(1);
            blockCount++;

            for (int offset = 0; offset < FitsReader.BLOCK_SIZE && !assembler.isEnded();
                offset += KeywordRecord.RECORD_SIZE) {
                KeywordRecord record = KeywordRecord.parse(block, offset, recordNumber);
                recordNumber++;
                assembler.accept(record);
            }

            lastBlock = assembler.isEnded() || isSentinel(block);
        } while (!lastBlock);

        HduOptions options = assembler.finish();
        log.debug("read a header of {} blocks", blockCount);
        return new Header(options, metadata, blockCount);
    }

    /**
     * Determines whether a block's last record marks the end of the header.
     */
    private static boolean isSentinel(byte[] block) {
        String keyword = new String(block, LAST_RECORD_OFFSET, KeywordRecord.KEYWORD_LENGTH, StandardCharsets.UTF_8)
            .trim();
        return keyword.isEmpty() || KeywordRecord.END.equals(keyword);
    }
}

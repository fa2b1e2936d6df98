package com.dcruver.litsync.extract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An image pulled out of an attachment, PNG encoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageBlob {
    private String name;
    private String mimeType;
    private int page;
    private int width;
    private int height;
    private byte[] data;
}

package com.dcruver.litsync.nlp;

import com.dcruver.litsync.extract.ImageBlob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryRequest {
    private String title;
    private String text;
    private List<ImageBlob> images;
    private String languageHint;
}

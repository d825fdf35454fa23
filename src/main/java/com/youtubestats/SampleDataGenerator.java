package com.youtubestats;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * Utility class to generate sample trending statistics for testing the pipeline.
 * Titles and descriptions are quoted and contain separators; a configurable share of
 * rows carries the kind of defects the error policy has to deal with.
 */
public class SampleDataGenerator {
    
    public static final String HEADER = "video_id,trending_date,title,channel_title,category_id,publish_time,tags,"
        + "views,likes,dislikes,comment_count,thumbnail_link,comments_disabled,ratings_disabled,description,region";
    
    private static final String[] REGIONS = {"US", "GB", "CA", "DE", "FR", "IN", "JP", "KR", "MX", "RU"};
    
    private static final String[] CHANNELS = {
        "Music Central", "Daily News", "Tech Reviews", "Cooking Lab", "Gaming Arena",
        "Travel Diaries", "Comedy Hour", "Science Now", "Sports Zone", "Film Trailers"
    };
    
    private static final String[] TOPICS = {
        "official video", "highlights", "review", "trailer", "live", "tutorial", "reaction", "interview"
    };
    
    private static final String[] BOOLEANS = {"False", "True", "false", "TRUE"};
    
    private static final String ID_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";
    
    private static final DateTimeFormatter TRENDING_DATE = DateTimeFormatter.ofPattern("yy.dd.MM");
    private static final DateTimeFormatter PUBLISH_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");
    
    public static void main(String[] args) throws IOException {
        int numRecords = args.length > 0 ? Integer.parseInt(args[0]) : 100000;
        String outputPath = args.length > 1 ? args[1] : "data/raw_statistics/sample.csv";
        double badFraction = args.length > 2 ? Double.parseDouble(args[2]) : 0.0;
        
        System.out.println("Generating " + numRecords + " sample records...");
        generateSampleData(numRecords, outputPath, badFraction);
        System.out.println("Sample data generated at: " + outputPath);
    }
    
    /**
     * Writes {@code numRecords} rows plus a header. The output is identical for identical arguments.
     *
     * @param badFraction share of rows (0..1) with a non-numeric counter, an invalid flag or an empty region
     */
    public static void generateSampleData(int numRecords, String outputPath, double badFraction) throws IOException {
        Random random = new Random(42); // Fixed seed for reproducibility
        Path path = Paths.get(outputPath);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        
        LocalDateTime start = LocalDateTime.of(2017, 11, 14, 0, 0);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            
            for (int i = 0; i < numRecords; i++) {
                LocalDateTime published = start.plusMinutes(random.nextInt(60 * 24 * 200));
                LocalDateTime trending = published.plusDays(1 + random.nextInt(10));
                String videoId = videoId(random);
                String channel = CHANNELS[random.nextInt(CHANNELS.length)];
                String topic = TOPICS[random.nextInt(TOPICS.length)];
                
                String views = String.valueOf(1000 + random.nextInt(5_000_000));
                String likes = String.valueOf(random.nextInt(200_000));
                String dislikes = String.valueOf(random.nextInt(20_000));
                String commentCount = String.valueOf(random.nextInt(50_000));
                String commentsDisabled = BOOLEANS[random.nextInt(BOOLEANS.length)];
                String ratingsDisabled = BOOLEANS[random.nextInt(BOOLEANS.length)];
                String region = REGIONS[random.nextInt(REGIONS.length)];
                
                if (random.nextDouble() < badFraction) {
                    switch (random.nextInt(3)) {
                        case 0:
                            views = "n/a";
                            break;
                        case 1:
                            commentsDisabled = "yes";
                            break;
                        default:
                            region = "";
                    }
                }
                
                writer.write(String.join(",",
                    videoId,
                    trending.format(TRENDING_DATE),
                    quote(channel + " - " + topic + ", part " + (i % 7 + 1)),
                    quote(channel),
                    String.valueOf(1 + random.nextInt(44)),
                    published.format(PUBLISH_TIME),
                    quote("\"" + topic + "\"|" + channel.toLowerCase().replace(' ', '-')),
                    views,
                    likes,
                    dislikes,
                    commentCount,
                    "https://i.ytimg.com/vi/" + videoId + "/default.jpg",
                    commentsDisabled,
                    ratingsDisabled,
                    quote("Watch the " + topic + ", then subscribe. Follow \"" + channel + "\" for more."),
                    region
                ));
                writer.newLine();
                
                if ((i + 1) % 10000 == 0) {
                    System.out.println("Generated " + (i + 1) + " records...");
                }
            }
        }
    }
    
    private static String videoId(Random random) {
        StringBuilder id = new StringBuilder(11);
        for (int i = 0; i < 11; i++) {
            id.append(ID_CHARS.charAt(random.nextInt(ID_CHARS.length())));
        }
        return id.toString();
    }
    
    private static String quote(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}

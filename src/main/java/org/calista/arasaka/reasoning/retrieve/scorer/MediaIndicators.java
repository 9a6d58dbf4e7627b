package org.calista.arasaka.reasoning.retrieve.scorer;

import java.util.List;

/**
 * Indicator vocabularies for music/video/entertainment content and for queries asking for it.
 * All entries are matched on word boundaries.
 */
public final class MediaIndicators {

    public static final List<String> MUSIC = List.of(
            "music video", "song", "songs", "youtube", "spotify", "official music", "lyrics", "album",
            "artist", "musical", "singer", "band", "concert", "live performance", "music festival",
            "playlist", "vinyl", "mp3", "guitar", "piano", "drums", "orchestra", "chorus", "melody",
            "harmony", "rhythm", "tempo", "genre", "jazz", "hip hop", "rap", "blues", "reggae", "folk",
            "indie", "grammy", "billboard", "mtv", "vmas", "american idol", "eurovision", "brit awards",
            "karaoke", "dj", "remix", "feat.", "featuring", "produced by", "composed by");

    public static final List<String> VIDEO = List.of(
            "video", "youtube video", "vimeo", "tiktok", "instagram reels", "snapchat", "twitch",
            "streaming", "subscribe", "viral", "vlog", "tutorial video", "video content", "film",
            "movie", "cinema", "documentary", "short film", "trailer", "clip", "episode", "netflix",
            "hulu", "amazon prime", "disney+", "hbo", "showtime", "hollywood", "bollywood",
            "tollywood", "nomination", "red carpet", "premiere", "cannes", "sundance", "oscar",
            "oscars", "golden globe", "emmy", "actor", "actress", "casting", "screenplay", "filming",
            "post-production");

    /** Query terms that show the user wants media content. */
    public static final List<String> QUERY_INTENT = List.of(
            "song", "songs", "music", "youtube", "listen", "play", "sing", "musical", "artist", "album",
            "concert", "band", "singer", "lyrics", "track", "playlist", "spotify", "melody", "harmony",
            "rhythm", "genre", "rock", "pop", "jazz", "classical", "hip hop", "rap", "country",
            "video", "watch", "stream", "movie", "film", "cinema", "tv show", "series", "episode",
            "netflix", "hulu", "tiktok", "instagram", "vlog", "trailer", "clip", "channel", "subscribe");

    public static final List<String> PROMOTIONAL = List.of(
            "learn everything you need to know", "discover everything about", "find out everything about",
            "get started with", "click here", "visit our website", "sign up", "subscribe", "join us");

    private MediaIndicators() {}
}
